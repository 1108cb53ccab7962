package stacker.planning.htn;

/**
 * Outcome of running a primitive task's operator during decomposition.
 */
public enum TaskStatus {
    SUCCESS,
    FAILURE
}
