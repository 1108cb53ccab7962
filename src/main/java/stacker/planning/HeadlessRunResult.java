package stacker.planning;

import stacker.domain.HeightGrid;
import stacker.domain.PlannedAction;
import stacker.domain.PlannedAction.ActionType;
import stacker.domain.Vec3;

import java.util.List;

/**
 * Everything a run produced: the replayed actions in order and the final
 * world. The same shape is returned for every outcome.
 */
public final class HeadlessRunResult {
    
    public final boolean reachedGoal;
    public final RunOutcome outcome;
    public final List<PlannedAction> actions;
    public final HeightGrid finalGrid;
    public final Vec3 finalAgentPos;
    public final boolean finalCarrying;
    /** Planning iterations entered, including the one that saw the goal */
    public final int iterations;
    
    HeadlessRunResult(RunOutcome outcome, List<PlannedAction> actions, World world, int iterations) {
        this.outcome = outcome;
        this.reachedGoal = outcome == RunOutcome.GOAL_REACHED;
        this.actions = List.copyOf(actions);
        this.finalGrid = world.getGrid();
        this.finalAgentPos = world.getAgentPos();
        this.finalCarrying = world.isCarrying();
        this.iterations = iterations;
    }
    
    public long count(ActionType type) {
        return actions.stream().filter(a -> a.type == type).count();
    }
    
    @Override
    public String toString() {
        return "HeadlessRunResult[" + outcome + ", actions=" + actions.size()
                + ", iterations=" + iterations + ", agent=" + finalAgentPos + "]";
    }
}
