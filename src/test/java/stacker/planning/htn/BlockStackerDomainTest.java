package stacker.planning.htn;

import org.junit.jupiter.api.Test;
import stacker.domain.*;
import stacker.domain.PlannedAction.ActionType;
import stacker.planning.SearchConfig;
import stacker.planning.World;
import stacker.planning.pathfinding.NavMeshPathfinder;
import stacker.planning.pathfinding.Pathfinder;
import stacker.planning.pathfinding.ShortHopPathfinder;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BlockStackerDomainTest {
    
    private static WorldSnapshot snapshotFor(Scenario scenario, Pathfinder pathfinder) {
        World world = World.initial(scenario.createInitialGrid(), scenario.getStartCell(),
                scenario.isStartCarrying(), pathfinder);
        return WorldSnapshot.fromWorld(world, scenario, pathfinder, SearchConfig.defaults().getFootprint());
    }
    
    private static DecompositionResult plan(WorldSnapshot snapshot, SearchConfig config) {
        return new Decomposer(config).decompose(BlockStackerDomain.create(config), snapshot);
    }
    
    private static List<ActionType> types(WorldSnapshot snapshot) {
        return snapshot.getActions().stream().map(a -> a.type).collect(Collectors.toList());
    }
    
    @Test
    void firstPassOfDefaultScenarioBuildsOneBlock() {
        WorldSnapshot snapshot = snapshotFor(Scenario.defaults(), new NavMeshPathfinder());
        
        DecompositionResult result = plan(snapshot, SearchConfig.defaults());
        
        assertTrue(result.isSuccess());
        assertEquals(List.of("SelectFrontier", "ChooseSupply", "NavigateToSupply", "PickBlock",
                "NavigateAdjacent", "PlaceBlock"), result.taskNames);
        assertEquals(List.of(ActionType.NAVIGATE, ActionType.PICK, ActionType.NAVIGATE, ActionType.PLACE),
                types(snapshot));
        
        List<PlannedAction> actions = snapshot.getActions();
        assertEquals("Walk to supply crate at (1, 1)", actions.get(0).description);
        assertEquals(Cell.of(1, 1), actions.get(1).cell);
        assertEquals(Cell.of(3, 2), actions.get(3).cell);
        assertEquals("Stack block for Step 1", actions.get(3).description);
        assertEquals(1, snapshot.getGrid().get(Cell.of(3, 2)));
        assertEquals(2, snapshot.getGrid().get(Cell.of(1, 1)));
        assertFalse(snapshot.isCarrying());
    }
    
    @Test
    void carriedBlockNextToFrontierIsPlacedDirectly() {
        Scenario scenario = new Scenario()
                .setStartCell(Cell.of(2, 2))
                .setGoalCell(Cell.of(3, 3))
                .setGoalHeight(2)
                .setSteps(List.of(StepDefinition.of(3, 2, 1, "Step to goal")))
                .setSupplies(List.of())
                .setStartCarrying(true);
        WorldSnapshot snapshot = snapshotFor(scenario, new NavMeshPathfinder());
        
        DecompositionResult result = plan(snapshot, SearchConfig.defaults());
        
        assertEquals(List.of("SelectFrontier", "HoldingBlock", "AlreadyAdjacent", "PlaceBlock"), result.taskNames);
        assertEquals(List.of(ActionType.PLACE), types(snapshot));
        assertEquals(new Vec3(3.5, 1.0, 2.5), snapshot.getActions().get(0).position);
    }
    
    @Test
    void finishedStaircaseClimbsStraightToGoal() {
        Scenario scenario = walkExistingStairs();
        WorldSnapshot snapshot = snapshotFor(scenario, new NavMeshPathfinder());
        
        DecompositionResult result = plan(snapshot, SearchConfig.defaults());
        
        assertEquals(List.of("ReachDirect"), result.taskNames);
        assertEquals(1, snapshot.getActions().size());
        assertEquals("Climb to the tower top", snapshot.getActions().get(0).description);
        assertEquals(new Vec3(3.5, 2.0, 3.5), snapshot.getAgentPos());
    }
    
    @Test
    void climbsStepByStepWhenGoalIsNotDirectlyReachable() {
        WorldSnapshot snapshot = snapshotFor(walkExistingStairs(), new ShortHopPathfinder());
        
        DecompositionResult result = plan(snapshot, SearchConfig.defaults());
        
        assertEquals(List.of("ClimbCompletedSteps"), result.taskNames);
        assertEquals(List.of("Walk existing Step 1", "Walk existing Goal column"),
                snapshot.getActions().stream().map(a -> a.description).collect(Collectors.toList()));
        assertEquals(new Vec3(3.5, 2.0, 3.5), snapshot.getAgentPos());
    }
    
    @Test
    void noPlanWhenSuppliesAreUsedUp() {
        Scenario scenario = Scenario.defaults().setSupplies(List.of());
        WorldSnapshot snapshot = snapshotFor(scenario, new NavMeshPathfinder());
        
        DecompositionResult result = plan(snapshot, SearchConfig.defaults());
        
        assertFalse(result.isSuccess());
        assertTrue(snapshot.getActions().isEmpty());
        assertEquals(5, snapshot.getGrid().totalBlocks());
    }
    
    @Test
    void lookaheadPlansWholeStaircaseInOnePass() {
        SearchConfig config = SearchConfig.defaults();
        config.setLookahead(true);
        Scenario scenario = Scenario.defaults();
        WorldSnapshot snapshot = snapshotFor(scenario, new NavMeshPathfinder());
        
        DecompositionResult result = plan(snapshot, config);
        
        assertEquals(List.of("PlanWholeStaircase"), result.taskNames);
        long places = snapshot.getActions().stream().filter(PlannedAction::isPlace).count();
        assertEquals(10, places);
        for (StepDefinition step : scenario.getSteps()) {
            assertTrue(step.isBuilt(snapshot.getGrid()), step.label);
        }
        assertEquals(snapshot.getGrid().cellTop(scenario.getGoalCell()), snapshot.getAgentPos());
    }
    
    @Test
    void lookaheadFallsBackWhenGoalIsOutOfReach() {
        SearchConfig config = SearchConfig.defaults();
        config.setLookahead(true);
        // Three blocks cannot finish a ten-block staircase
        Scenario scenario = Scenario.defaults().setSupplies(List.of(SupplySource.of(1, 1, 3)));
        WorldSnapshot snapshot = snapshotFor(scenario, new NavMeshPathfinder());
        
        DecompositionResult result = plan(snapshot, config);
        
        assertTrue(result.isSuccess());
        assertFalse(result.taskNames.contains("PlanWholeStaircase"));
        assertEquals(1, snapshot.getActions().stream().filter(PlannedAction::isPlace).count());
    }
    
    private static Scenario walkExistingStairs() {
        return new Scenario()
                .setStartCell(Cell.of(3, 1))
                .setGoalCell(Cell.of(3, 3))
                .setGoalHeight(0)
                .setSteps(List.of(
                        StepDefinition.of(3, 2, 1, "Step 1"),
                        StepDefinition.of(3, 3, 2, "Goal column")))
                .setSupplies(List.of())
                .setInitialHeights(Map.of(Cell.of(3, 2), 1, Cell.of(3, 3), 2));
    }
}
