package stacker.planning.selection;

import org.junit.jupiter.api.Test;
import stacker.domain.*;
import stacker.planning.pathfinding.Footprint;
import stacker.planning.pathfinding.NavMeshPathfinder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SupplySelectorTest {
    
    private static final List<StepDefinition> ONE_STEP = List.of(StepDefinition.of(3, 2, 1, "Step 1"));
    
    private final NavMeshPathfinder pathfinder = new NavMeshPathfinder();
    private final SupplySelector selector = new SupplySelector(pathfinder, Footprint.AGENT);
    
    private PlannedStep choose(HeightGrid grid, Cell agentCell, List<StepDefinition> steps,
                               List<SupplySource> supplies) {
        return selector.chooseSupply(grid, pathfinder.rebuildNavMesh(grid), grid.cellTop(agentCell),
                steps, supplies, Cell.of(3, 1));
    }
    
    private static HeightGrid gridWith(List<SupplySource> supplies) {
        HeightGrid grid = new HeightGrid(8, 8);
        for (SupplySource source : supplies) {
            grid.set(source.cell, source.height);
        }
        return grid;
    }
    
    @Test
    void picksNearestStandOfNearestSupply() {
        List<SupplySource> supplies = List.of(SupplySource.of(6, 6, 2), SupplySource.of(1, 1, 3));
        HeightGrid grid = gridWith(supplies);
        
        PlannedStep step = choose(grid, Cell.of(3, 1), ONE_STEP, supplies);
        
        assertNotNull(step);
        assertEquals(Cell.of(1, 1), step.supply);
        assertEquals(Cell.of(2, 1), step.stand);
        assertEquals(grid.cellTop(Cell.of(2, 1)), step.standTop);
        assertEquals(1.0, step.pathLength, 1e-9);
        assertEquals(ONE_STEP.get(0), step.frontier);
        assertEquals(Cell.of(3, 1), step.anchor);
    }
    
    @Test
    void skipsEmptySupplies() {
        List<SupplySource> supplies = List.of(SupplySource.of(1, 1, 0), SupplySource.of(6, 1, 1));
        HeightGrid grid = gridWith(supplies);
        
        PlannedStep step = choose(grid, Cell.of(3, 1), ONE_STEP, supplies);
        
        assertEquals(Cell.of(6, 1), step.supply);
        assertEquals(Cell.of(5, 1), step.stand);
    }
    
    @Test
    void tiesGoToEarlierSupply() {
        // Each supply has a stand one cell from the agent
        List<SupplySource> supplies = List.of(SupplySource.of(5, 1, 1), SupplySource.of(1, 1, 1));
        HeightGrid grid = gridWith(supplies);
        
        PlannedStep step = choose(grid, Cell.of(3, 1), ONE_STEP, supplies);
        
        assertEquals(Cell.of(5, 1), step.supply);
        assertEquals(Cell.of(4, 1), step.stand);
    }
    
    @Test
    void nullWhenNothingLeftToBuild() {
        List<SupplySource> supplies = List.of(SupplySource.of(1, 1, 3));
        HeightGrid grid = gridWith(supplies);
        grid.set(Cell.of(3, 2), 1);
        
        assertNull(choose(grid, Cell.of(3, 1), ONE_STEP, supplies));
    }
    
    @Test
    void nullWhenNoSupplyCanBeApproached() {
        List<SupplySource> supplies = List.of(SupplySource.of(0, 0, 1));
        HeightGrid grid = gridWith(supplies);
        // Wall off both stands of the corner supply
        grid.set(Cell.of(1, 0), 4);
        grid.set(Cell.of(0, 1), 4);
        
        assertNull(choose(grid, Cell.of(3, 1), ONE_STEP, supplies));
    }
}
