package stacker.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioTest {
    
    @Test
    void defaultGridHasGoalTowerAndSupplies() {
        HeightGrid grid = Scenario.defaults().createInitialGrid();
        
        assertEquals(8, grid.getWidth());
        assertEquals(8, grid.getDepth());
        assertEquals(5, grid.get(Cell.of(3, 6)));
        assertEquals(3, grid.get(Cell.of(1, 1)));
        assertEquals(3, grid.get(Cell.of(4, 4)));
        // Goal tower plus 12 supply blocks
        assertEquals(17, grid.totalBlocks());
        for (StepDefinition step : Scenario.DEFAULT_STEPS) {
            assertEquals(0, grid.get(step.cell), step.label);
        }
    }
    
    @Test
    void initialHeightsOverrideSupplies() {
        Scenario scenario = new Scenario()
                .setSupplies(List.of(SupplySource.of(2, 2, 2)))
                .setInitialHeights(Map.of(Cell.of(2, 2), 1));
        
        assertEquals(1, scenario.createInitialGrid().get(Cell.of(2, 2)));
    }
    
    @Test
    void suppliesOverrideGoalHeight() {
        Scenario scenario = new Scenario()
                .setGoalCell(Cell.of(2, 2))
                .setGoalHeight(4)
                .setSupplies(List.of(SupplySource.of(2, 2, 1)));
        
        assertEquals(1, scenario.createInitialGrid().get(Cell.of(2, 2)));
    }
    
    @Test
    void rejectsCellsOutsideTheGrid() {
        Scenario badGoal = new Scenario().setGoalCell(Cell.of(8, 0));
        Scenario badStep = new Scenario().setSteps(List.of(StepDefinition.of(0, 9, 1, "Off grid")));
        
        assertThrows(IllegalArgumentException.class, badGoal::createInitialGrid);
        assertThrows(IllegalArgumentException.class, badStep::createInitialGrid);
    }
    
    @Test
    void gridsAreFreshEachTime() {
        Scenario scenario = Scenario.defaults();
        HeightGrid first = scenario.createInitialGrid();
        first.increment(Cell.of(0, 0));
        
        assertEquals(0, scenario.createInitialGrid().get(Cell.of(0, 0)));
    }
}
