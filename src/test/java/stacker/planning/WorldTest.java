package stacker.planning;

import org.junit.jupiter.api.Test;
import stacker.domain.*;
import stacker.planning.pathfinding.NavMeshPathfinder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorldTest {
    
    private final NavMeshPathfinder pathfinder = new NavMeshPathfinder();
    private final Scenario scenario = Scenario.defaults();
    
    private World initial() {
        return World.initial(scenario.createInitialGrid(), scenario.getStartCell(), false, pathfinder);
    }
    
    @Test
    void agentStartsOnTopOfStartCell() {
        World world = initial();
        
        assertEquals(new Vec3(3.5, 0.0, 1.5), world.getAgentPos());
        assertFalse(world.isCarrying());
        assertEquals(17, world.totalBlocks());
    }
    
    @Test
    void applyingActionsLeavesOriginalUntouched() {
        World world = initial();
        World picked = world.apply(PlannedAction.pick(Cell.of(1, 1), new Vec3(1.5, 3, 1.5), "Pick"),
                pathfinder, scenario.getGoalCell());
        
        assertEquals(3, world.heightAt(Cell.of(1, 1)));
        assertEquals(2, picked.heightAt(Cell.of(1, 1)));
        assertTrue(picked.isCarrying());
        assertEquals(world.totalBlocks(), picked.totalBlocks());
    }
    
    @Test
    void gridAccessorReturnsCopy() {
        World world = initial();
        world.getGrid().increment(Cell.of(0, 0));
        
        assertEquals(0, world.heightAt(Cell.of(0, 0)));
    }
    
    @Test
    void navigateMovesAgentToTarget() {
        World world = initial();
        Vec3 target = new Vec3(2.5, 0, 1.5);
        
        World moved = world.apply(PlannedAction.navigate(List.of(world.getAgentPos(), target), target, "Walk"),
                pathfinder, scenario.getGoalCell());
        
        assertEquals(target, moved.getAgentPos());
        assertSame(world.getNavMesh(), moved.getNavMesh());
    }
    
    @Test
    void placeOnGoalLiftsAgentAndRebuildsNavMesh() {
        World world = World.initial(scenario.createInitialGrid(), scenario.getStartCell(), true, pathfinder);
        Cell goal = scenario.getGoalCell();
        
        World placed = world.apply(PlannedAction.place(goal, new Vec3(3.5, 6, 6.5), "Place"), pathfinder, goal);
        
        assertEquals(6, placed.heightAt(goal));
        assertFalse(placed.isCarrying());
        assertEquals(new Vec3(3.5, 6.0, 6.5), placed.getAgentPos());
        assertEquals(6.0, placed.getNavMesh().surfaceHeight(goal), 1e-9);
    }
    
    @Test
    void placeElsewhereKeepsAgentWhereItIs() {
        World world = World.initial(scenario.createInitialGrid(), scenario.getStartCell(), true, pathfinder);
        
        World placed = world.apply(PlannedAction.place(Cell.of(3, 2), new Vec3(3.5, 1, 2.5), "Place"),
                pathfinder, scenario.getGoalCell());
        
        assertEquals(world.getAgentPos(), placed.getAgentPos());
        assertEquals(1, placed.heightAt(Cell.of(3, 2)));
    }
}
