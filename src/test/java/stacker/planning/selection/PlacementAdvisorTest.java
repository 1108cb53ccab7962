package stacker.planning.selection;

import org.junit.jupiter.api.Test;
import stacker.domain.Cell;
import stacker.domain.HeightGrid;
import stacker.domain.Vec3;
import stacker.planning.pathfinding.Footprint;
import stacker.planning.pathfinding.NavMeshPathfinder;

import static org.junit.jupiter.api.Assertions.*;

class PlacementAdvisorTest {
    
    private final NavMeshPathfinder pathfinder = new NavMeshPathfinder();
    private final PlacementAdvisor advisor = new PlacementAdvisor(pathfinder, Footprint.AGENT);
    
    @Test
    void placesDirectlyFromLevelNeighbour() {
        HeightGrid grid = new HeightGrid(8, 8);
        Vec3 agent = grid.cellTop(Cell.of(2, 2));
        
        assertTrue(PlacementAdvisor.canPlaceDirectlyOnAdjacent(grid, agent, true, Cell.of(3, 2)));
    }
    
    @Test
    void placesDirectlyFromOneBlockAbove() {
        HeightGrid grid = new HeightGrid(8, 8);
        grid.set(Cell.of(2, 2), 1);
        Vec3 agent = grid.cellTop(Cell.of(2, 2));
        
        assertTrue(PlacementAdvisor.canPlaceDirectlyOnAdjacent(grid, agent, true, Cell.of(3, 2)));
    }
    
    @Test
    void noDirectPlacementWhenEmptyHandedFarOrTooHigh() {
        HeightGrid grid = new HeightGrid(8, 8);
        Vec3 level = grid.cellTop(Cell.of(2, 2));
        Vec3 diagonal = grid.cellTop(Cell.of(2, 1));
        grid.set(Cell.of(4, 2), 2);
        Vec3 tooHigh = grid.cellTop(Cell.of(4, 2));
        
        assertFalse(PlacementAdvisor.canPlaceDirectlyOnAdjacent(grid, level, false, Cell.of(3, 2)));
        assertFalse(PlacementAdvisor.canPlaceDirectlyOnAdjacent(grid, diagonal, true, Cell.of(3, 2)));
        assertFalse(PlacementAdvisor.canPlaceDirectlyOnAdjacent(grid, tooHigh, true, Cell.of(3, 2)));
    }
    
    @Test
    void agentBelowFrontierCannotPlace() {
        HeightGrid grid = new HeightGrid(8, 8);
        grid.set(Cell.of(3, 2), 2);
        Vec3 agent = grid.cellTop(Cell.of(2, 2));
        
        assertFalse(PlacementAdvisor.canPlaceDirectlyOnAdjacent(grid, agent, true, Cell.of(3, 2)));
    }
    
    @Test
    void adjacentMoveScansPositiveXFirst() {
        HeightGrid grid = new HeightGrid(8, 8);
        
        AdjacentMove move = advisor.findAdjacentPlacementMove(grid, pathfinder.rebuildNavMesh(grid),
                grid.cellTop(Cell.of(0, 0)), Cell.of(3, 2));
        
        assertNotNull(move);
        assertEquals(Cell.of(4, 2), move.adjacentCell);
        assertEquals(0, move.targetHeight);
        assertEquals(grid.cellTop(Cell.of(4, 2)), move.targetPos);
    }
    
    @Test
    void adjacentMoveNeedsNeighbourAtFrontierHeight() {
        HeightGrid grid = new HeightGrid(8, 8);
        grid.set(Cell.of(3, 3), 1);
        // Only the -z neighbour is tall enough to stand level with the frontier
        grid.set(Cell.of(3, 2), 1);
        
        AdjacentMove move = advisor.findAdjacentPlacementMove(grid, pathfinder.rebuildNavMesh(grid),
                grid.cellTop(Cell.of(4, 2)), Cell.of(3, 3));
        
        assertNotNull(move);
        assertEquals(Cell.of(3, 2), move.adjacentCell);
        assertEquals(1, move.targetHeight);
        assertEquals(new Vec3(3.5, 1.0, 2.5), move.targetPos);
    }
    
    @Test
    void noAdjacentMoveWhenNeighboursTooLow() {
        HeightGrid grid = new HeightGrid(8, 8);
        grid.set(Cell.of(3, 3), 2);
        
        assertNull(advisor.findAdjacentPlacementMove(grid, pathfinder.rebuildNavMesh(grid),
                grid.cellTop(Cell.of(0, 0)), Cell.of(3, 3)));
    }
}
