package stacker.planning.htn;

import stacker.domain.*;
import stacker.planning.SearchConfig;
import stacker.planning.pathfinding.Pathfinder.PathResult;
import stacker.planning.selection.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The block-stacking task network.
 * 
 * <pre>
 * AchieveGoal (select)
 *   [PlanWholeStaircase]       only with look-ahead enabled
 *   ReachDirect                staircase done, goal top reachable
 *   ClimbCompletedSteps        staircase done, walk the steps in order, then the goal
 *   BuildStep (sequence)
 *     SelectFrontier
 *     AcquireBlock (select)
 *       HoldingBlock
 *       FetchFromSupply (sequence)
 *         ChooseSupply
 *         NavigateToSupply
 *         PickBlock
 *     ReachPlacementPosition (select)
 *       AlreadyAdjacent
 *       NavigateAdjacent
 *       NavigateToAnchor
 *     PlaceBlock
 * </pre>
 * 
 * Without look-ahead a pass emits at most one block's worth of actions; the
 * runner replans after replaying them.
 */
public final class BlockStackerDomain {
    
    public static final String ROOT = "AchieveGoal";
    
    private BlockStackerDomain() {}
    
    /**
     * Builds the task network. The tree holds no state between passes and
     * can be decomposed any number of times.
     */
    public static Task create(SearchConfig config) {
        Task reachDirect = reachDirect();
        Task climbCompletedSteps = climbCompletedSteps();
        Task buildStep = buildStep();
        
        if (!config.isLookahead()) {
            return CompoundTask.select(ROOT, reachDirect, climbCompletedSteps, buildStep);
        }
        Task advance = CompoundTask.select("Advance", reachDirect, climbCompletedSteps, buildStep);
        return CompoundTask.select(ROOT,
                planWholeStaircase(advance, new Decomposer(config), config),
                reachDirect, climbCompletedSteps, buildStep);
    }
    
    // ========== Climb ==========
    
    private static Task reachDirect() {
        return new PrimitiveTask("ReachDirect",
                List.of(staircaseComplete()),
                s -> {
                    Vec3 goalTop = goalTop(s);
                    PlannedAction climb = routeTo(s, s.getAgentPos(), goalTop, "Climb to the tower top");
                    if (climb == null) return TaskStatus.FAILURE;
                    s.setPendingRoute(List.of(climb));
                    return TaskStatus.SUCCESS;
                },
                WorldSnapshot::commitRoute);
    }
    
    private static Task climbCompletedSteps() {
        return new PrimitiveTask("ClimbCompletedSteps",
                List.of(staircaseComplete()),
                s -> {
                    List<PlannedAction> route = new ArrayList<>();
                    Vec3 current = s.getAgentPos();
                    for (StepDefinition step : s.getScenario().getSteps()) {
                        Vec3 stepTop = s.getGrid().cellTop(step.cell);
                        if (GoalChecker.isSamePosition(current, stepTop)) continue;
                        PlannedAction hop = routeTo(s, current, stepTop, "Walk existing " + step.label);
                        if (hop == null) {
                            logNormal("ClimbCompletedSteps: no path from " + current + " to " + step.label);
                            return TaskStatus.FAILURE;
                        }
                        route.add(hop);
                        current = stepTop;
                    }
                    Vec3 goalTop = goalTop(s);
                    if (!GoalChecker.isSamePosition(current, goalTop)) {
                        PlannedAction hop = routeTo(s, current, goalTop, "Climb to goal top");
                        if (hop == null) {
                            logNormal("ClimbCompletedSteps: no path from " + current + " to the goal top");
                            return TaskStatus.FAILURE;
                        }
                        route.add(hop);
                    }
                    if (route.isEmpty()) return TaskStatus.FAILURE;
                    s.setPendingRoute(route);
                    return TaskStatus.SUCCESS;
                },
                WorldSnapshot::commitRoute);
    }
    
    // ========== Build ==========
    
    private static Task buildStep() {
        return CompoundTask.sequence("BuildStep",
                selectFrontier(),
                CompoundTask.select("AcquireBlock",
                        holdingBlock(),
                        CompoundTask.sequence("FetchFromSupply",
                                chooseSupply(),
                                navigateToSupply(),
                                pickBlock())),
                CompoundTask.select("ReachPlacementPosition",
                        alreadyAdjacent(),
                        navigateAdjacent(),
                        navigateToAnchor()),
                placeBlock());
    }
    
    private static Task selectFrontier() {
        return PrimitiveTask.of("SelectFrontier",
                List.of(Condition.of("Frontier exists", s -> frontierOf(s).isPresent())),
                s -> {
                    StepDefinition frontier = frontierOf(s).orElseThrow();
                    s.setFrontier(frontier);
                    s.setAnchor(FrontierSelector.anchorFor(s.getScenario().getSteps(), frontier,
                            s.getScenario().getStartCell()));
                    logVerbose("SelectFrontier: " + frontier + " anchor " + s.getAnchor());
                });
    }
    
    private static Task holdingBlock() {
        return PrimitiveTask.of("HoldingBlock",
                List.of(Condition.of("Carrying", WorldSnapshot::isCarrying)),
                null);
    }
    
    private static Task chooseSupply() {
        return new PrimitiveTask("ChooseSupply",
                List.of(Condition.of("Hands free", s -> !s.isCarrying())),
                s -> {
                    SupplySelector selector = new SupplySelector(s.getPathfinder(), s.getFootprint());
                    Scenario scenario = s.getScenario();
                    PlannedStep step = selector.chooseSupply(s.getGrid(), s.getNavMesh(), s.getAgentPos(),
                            scenario.getSteps(), scenario.getSupplies(), scenario.getStartCell());
                    s.setPendingStep(step);
                    return step != null ? TaskStatus.SUCCESS : TaskStatus.FAILURE;
                },
                null);
    }
    
    private static Task navigateToSupply() {
        return new PrimitiveTask("NavigateToSupply",
                List.of(Condition.of("Supply chosen", s -> s.getPendingStep() != null)),
                s -> {
                    PlannedStep step = s.getPendingStep();
                    if (GoalChecker.isSamePosition(s.getAgentPos(), step.standTop)) {
                        s.setPendingRoute(List.of());
                    } else {
                        s.setPendingRoute(List.of(PlannedAction.navigate(step.pathToStand, step.standTop,
                                "Walk to supply crate at " + describe(step.supply))));
                    }
                    return TaskStatus.SUCCESS;
                },
                WorldSnapshot::commitRoute);
    }
    
    private static Task pickBlock() {
        return PrimitiveTask.of("PickBlock",
                List.of(Condition.of("Supply chosen", s -> s.getPendingStep() != null),
                        Condition.of("Hands free", s -> !s.isCarrying()),
                        Condition.of("Supply stocked", s -> s.getGrid().get(s.getPendingStep().supply) > 0)),
                s -> {
                    Cell supply = s.getPendingStep().supply;
                    Vec3 top = s.getGrid().cellTop(supply);
                    s.pick(supply);
                    s.enqueue(PlannedAction.pick(supply, top, "Pick block at " + describe(supply)));
                });
    }
    
    private static Task alreadyAdjacent() {
        return PrimitiveTask.of("AlreadyAdjacent",
                List.of(Condition.of("Can place from here", s -> s.getFrontier() != null
                        && PlacementAdvisor.canPlaceDirectlyOnAdjacent(s.getGrid(), s.getAgentPos(),
                                s.isCarrying(), s.getFrontier().cell))),
                null);
    }
    
    private static Task navigateAdjacent() {
        return new PrimitiveTask("NavigateAdjacent",
                List.of(Condition.of("Frontier selected", s -> s.getFrontier() != null),
                        Condition.of("Carrying", WorldSnapshot::isCarrying)),
                s -> {
                    PlacementAdvisor advisor = new PlacementAdvisor(s.getPathfinder(), s.getFootprint());
                    AdjacentMove move = advisor.findAdjacentPlacementMove(s.getGrid(), s.getNavMesh(),
                            s.getAgentPos(), s.getFrontier().cell);
                    if (move == null) return TaskStatus.FAILURE;
                    s.setPendingRoute(List.of(PlannedAction.navigate(move.path, move.targetPos,
                            "Move to position adjacent to " + s.getFrontier().label)));
                    return TaskStatus.SUCCESS;
                },
                WorldSnapshot::commitRoute);
    }
    
    private static Task navigateToAnchor() {
        return new PrimitiveTask("NavigateToAnchor",
                List.of(Condition.of("Frontier selected", s -> s.getFrontier() != null && s.getAnchor() != null),
                        Condition.of("Carrying", WorldSnapshot::isCarrying)),
                s -> {
                    Vec3 anchorTop = s.getGrid().cellTop(s.getAnchor());
                    if (GoalChecker.isSamePosition(s.getAgentPos(), anchorTop)) {
                        s.setPendingRoute(List.of());
                        return TaskStatus.SUCCESS;
                    }
                    PlannedAction carry = routeTo(s, s.getAgentPos(), anchorTop,
                            "Carry block to " + s.getFrontier().label + " staging cell");
                    if (carry == null) return TaskStatus.FAILURE;
                    s.setPendingRoute(List.of(carry));
                    return TaskStatus.SUCCESS;
                },
                WorldSnapshot::commitRoute);
    }
    
    private static Task placeBlock() {
        return PrimitiveTask.of("PlaceBlock",
                List.of(Condition.of("Frontier selected", s -> s.getFrontier() != null),
                        Condition.of("Carrying", WorldSnapshot::isCarrying)),
                s -> {
                    StepDefinition frontier = s.getFrontier();
                    s.place(frontier.cell);
                    s.enqueue(PlannedAction.place(frontier.cell, s.getGrid().cellTop(frontier.cell),
                            "Stack block for " + frontier.label));
                    s.setPendingStep(null);
                    logVerbose("PlaceBlock: " + frontier.label + " now " + s.getGrid().get(frontier.cell)
                            + "/" + frontier.targetHeight);
                });
    }
    
    // ========== Look-ahead ==========
    
    /**
     * Simulates the whole build-and-climb loop on the snapshot. Succeeds only
     * if the simulation ends on the goal top; otherwise the snapshot is rolled
     * back and the incremental branches get their turn.
     */
    private static Task planWholeStaircase(Task advance, Decomposer inner, SearchConfig config) {
        return new PrimitiveTask("PlanWholeStaircase",
                List.of(Condition.of("Goal not reached", s -> !isGoalState(s))),
                s -> {
                    int limit = config.resolveMaxIterations(s.getScenario());
                    WorldSnapshot.Checkpoint start = s.checkpoint();
                    
                    for (int pass = 0; pass < limit && !isGoalState(s); pass++) {
                        int before = s.getActions().size();
                        DecompositionResult result = inner.decompose(advance, s);
                        if (!result.isSuccess() || s.getActions().size() == before) {
                            logNormal("PlanWholeStaircase: simulation stalled after " + pass + " passes");
                            break;
                        }
                    }
                    if (isGoalState(s)) {
                        logVerbose("PlanWholeStaircase: full plan of " + s.getActions().size() + " actions");
                        return TaskStatus.SUCCESS;
                    }
                    s.restore(start);
                    return TaskStatus.FAILURE;
                },
                null);
    }
    
    // ========== Helpers ==========
    
    private static Condition staircaseComplete() {
        return Condition.of("Staircase complete", s -> frontierOf(s).isEmpty());
    }
    
    private static Optional<StepDefinition> frontierOf(WorldSnapshot s) {
        return FrontierSelector.frontier(s.getGrid(), s.getScenario().getSteps());
    }
    
    private static boolean isGoalState(WorldSnapshot s) {
        return GoalChecker.isGoalState(s.getGrid(), s.getAgentPos(), s.getScenario().getSteps(),
                s.getScenario().getGoalCell());
    }
    
    private static Vec3 goalTop(WorldSnapshot s) {
        return s.getGrid().cellTop(s.getScenario().getGoalCell());
    }
    
    /**
     * @return a Navigate along the found path, or null when the target is unreachable
     */
    private static PlannedAction routeTo(WorldSnapshot s, Vec3 from, Vec3 target, String description) {
        PathResult path = s.getPathfinder().findPath(s.getNavMesh(), from, target, s.getFootprint());
        if (!path.isUsable()) return null;
        return PlannedAction.navigate(path.waypoints, target, description);
    }
    
    private static String describe(Cell cell) {
        return "(" + cell.x + ", " + cell.z + ")";
    }
    
    private static void logNormal(String msg) {
        if (SearchConfig.isNormal()) System.err.println("[BlockStackerDomain] " + msg);
    }
    
    private static void logVerbose(String msg) {
        if (SearchConfig.isVerbose()) System.err.println("[BlockStackerDomain] " + msg);
    }
}
