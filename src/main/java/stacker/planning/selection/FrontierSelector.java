package stacker.planning.selection;

import stacker.domain.Cell;
import stacker.domain.HeightGrid;
import stacker.domain.StepDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Picks the staircase step to work on next.
 */
public class FrontierSelector {
    
    /**
     * First step, in declaration order, whose column is still below its target.
     * 
     * @param grid current heights
     * @param steps the staircase
     * @return the frontier step, or empty when the staircase is complete
     */
    public static Optional<StepDefinition> frontier(HeightGrid grid, List<StepDefinition> steps) {
        for (StepDefinition step : steps) {
            if (grid.get(step.cell) < step.targetHeight) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }
    
    /**
     * Staging cell for a frontier step: the previous step's cell, or the
     * start cell when the frontier is the first step.
     */
    public static Cell anchorFor(List<StepDefinition> steps, StepDefinition frontier, Cell startCell) {
        int index = steps.indexOf(frontier);
        if (index <= 0) {
            return startCell;
        }
        return steps.get(index - 1).cell;
    }
}
