package stacker.planning;

import stacker.domain.PlannedAction;
import stacker.domain.Scenario;
import stacker.planning.htn.BlockStackerDomain;
import stacker.planning.htn.Decomposer;
import stacker.planning.htn.DecompositionResult;
import stacker.planning.htn.Task;
import stacker.planning.htn.WorldSnapshot;
import stacker.planning.pathfinding.NavMeshOptions;
import stacker.planning.pathfinding.NavMeshPathfinder;
import stacker.planning.pathfinding.Pathfinder;
import stacker.planning.selection.GoalChecker;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Plan-act-replan loop without any rendering.
 * 
 * Each iteration checks the abort signal and the goal, then decomposes the
 * task network against a fresh snapshot of the live world, and replays the
 * emitted actions onto the world. The live world is replaced only after the
 * whole plan has been replayed.
 */
public class HeadlessRunner {
    
    private final SearchConfig config;
    private final Pathfinder pathfinder;
    private final Task domain;
    private final Decomposer decomposer;
    private PlannerListener listener = PlannerListener.NONE;
    
    public HeadlessRunner() {
        this(SearchConfig.defaults());
    }
    
    public HeadlessRunner(SearchConfig config) {
        this(config, new NavMeshPathfinder(NavMeshOptions.defaults(), config.getMaxPathExpansions()));
    }
    
    public HeadlessRunner(SearchConfig config, Pathfinder pathfinder) {
        this.config = Objects.requireNonNull(config, "config");
        this.pathfinder = Objects.requireNonNull(pathfinder, "pathfinder");
        this.domain = BlockStackerDomain.create(config);
        this.decomposer = new Decomposer(config);
    }
    
    public void setListener(PlannerListener listener) {
        this.listener = listener != null ? listener : PlannerListener.NONE;
    }
    
    public HeadlessRunResult run(Scenario scenario) {
        return run(scenario, () -> false);
    }
    
    /**
     * @param scenario the world to build in
     * @param abort checked before every iteration; true stops the run
     * @return the run's actions and final world, whatever the outcome
     */
    public HeadlessRunResult run(Scenario scenario, BooleanSupplier abort) {
        long startTime = System.currentTimeMillis();
        int maxIterations = config.resolveMaxIterations(scenario);
        World world = World.initial(scenario.createInitialGrid(), scenario.getStartCell(),
                scenario.isStartCarrying(), pathfinder);
        List<PlannedAction> executed = new ArrayList<>();
        
        if (SearchConfig.isMinimal()) {
            System.err.println("[HeadlessRunner] Scenario '" + scenario.getName() + "': "
                    + scenario.getSteps().size() + " steps, " + world.totalBlocks()
                    + " blocks, budget " + maxIterations + " iterations");
        }
        
        int iteration = 0;
        while (iteration < maxIterations) {
            iteration++;
            
            if (abort.getAsBoolean()) {
                log("Aborted at iteration " + iteration);
                return finish(RunOutcome.ABORTED, executed, world, iteration, startTime);
            }
            
            if (GoalChecker.isGoalState(world.getGrid(), world.getAgentPos(), scenario.getSteps(),
                    scenario.getGoalCell())) {
                return finish(RunOutcome.GOAL_REACHED, executed, world, iteration, startTime);
            }
            
            WorldSnapshot snapshot = WorldSnapshot.fromWorld(world, scenario, pathfinder, config.getFootprint());
            DecompositionResult result = decomposer.decompose(domain, snapshot);
            List<PlannedAction> plan = snapshot.getActions();
            
            if (SearchConfig.isNormal()) {
                System.err.println("[HeadlessRunner] Iteration " + iteration + ": " + result.status
                        + ", " + plan.size() + " actions " + result.taskNames);
            }
            listener.onStatus("Iteration " + iteration + ": " + plan.size() + " actions");
            
            if (plan.isEmpty()) {
                log("No actions produced at iteration " + iteration + " (agent " + world.getAgentPos()
                        + ", carrying=" + world.isCarrying() + ")");
                return finish(RunOutcome.STUCK, executed, world, iteration, startTime);
            }
            
            World next = world;
            for (PlannedAction action : plan) {
                next = next.apply(action, pathfinder, scenario.getGoalCell());
                executed.add(action);
                listener.onAction(action);
            }
            world = next;
        }
        
        log("Iteration budget of " + maxIterations + " exhausted");
        return finish(RunOutcome.ITERATIONS_EXHAUSTED, executed, world, iteration, startTime);
    }
    
    private HeadlessRunResult finish(RunOutcome outcome, List<PlannedAction> executed, World world,
                                     int iterations, long startTime) {
        if (SearchConfig.isMinimal()) {
            long elapsed = System.currentTimeMillis() - startTime;
            System.err.println("[HeadlessRunner] " + outcome + " after " + iterations + " iterations, "
                    + executed.size() + " actions, " + elapsed + "ms");
        }
        listener.onStatus(outcome == RunOutcome.GOAL_REACHED ? "Goal reached" : "Stopped: " + outcome);
        return new HeadlessRunResult(outcome, executed, world, iterations);
    }
    
    private void log(String msg) {
        if (SearchConfig.isMinimal()) System.err.println("[HeadlessRunner] " + msg);
    }
}
