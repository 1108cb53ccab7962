package stacker.planning;

/**
 * How a headless run ended.
 */
public enum RunOutcome {
    /** Staircase built and the agent stands on the goal top */
    GOAL_REACHED,
    /** A planning pass produced no actions */
    STUCK,
    /** Iteration budget used up before the goal */
    ITERATIONS_EXHAUSTED,
    /** The caller's abort signal fired */
    ABORTED
}
