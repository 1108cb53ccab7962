package stacker.planning;

import stacker.domain.PlannedAction;

/**
 * Callbacks from the runner for a presentation layer.
 */
public interface PlannerListener {
    
    PlannerListener NONE = new PlannerListener() {};
    
    /** One-line progress message, e.g. "Iteration 3: 4 actions". */
    default void onStatus(String status) {}
    
    /** Called for each action as it is replayed onto the live world. */
    default void onAction(PlannedAction action) {}
}
