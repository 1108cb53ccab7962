package stacker.planning.selection;

import stacker.domain.Cell;
import stacker.domain.HeightGrid;
import stacker.domain.StepDefinition;
import stacker.domain.Vec3;
import stacker.planning.SearchConfig;

import java.util.List;

/**
 * Goal state checking utilities.
 */
public class GoalChecker {
    
    /**
     * Checks if the agent stands on the goal column's top, within the
     * horizontal and vertical tolerances.
     */
    public static boolean hasAgentReachedGoal(HeightGrid grid, Vec3 agentPos, Cell goalCell) {
        Vec3 goalTop = grid.cellTop(goalCell);
        return agentPos.horizontalDistanceTo(goalTop) <= SearchConfig.GOAL_HORIZONTAL_TOLERANCE
                && Math.abs(agentPos.y - goalTop.y) <= SearchConfig.GOAL_VERTICAL_TOLERANCE;
    }
    
    /**
     * The whole run is done: every step built and the agent on the goal top.
     */
    public static boolean isGoalState(HeightGrid grid, Vec3 agentPos, List<StepDefinition> steps, Cell goalCell) {
        return FrontierSelector.frontier(grid, steps).isEmpty() && hasAgentReachedGoal(grid, agentPos, goalCell);
    }
    
    /**
     * Checks if two positions are the same spot for planning purposes.
     */
    public static boolean isSamePosition(Vec3 a, Vec3 b) {
        return a.distanceTo(b) < SearchConfig.SAME_POSITION_EPSILON;
    }
}
