package stacker.planning.htn;

import stacker.domain.*;
import stacker.planning.World;
import stacker.planning.pathfinding.Footprint;
import stacker.planning.pathfinding.NavMesh;
import stacker.planning.pathfinding.Pathfinder;
import stacker.planning.selection.PlannedStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mutable planning state for one decomposition pass.
 * 
 * Owns its own copy of the heights, so effects applied during search never
 * reach the live {@link World}. Also carries the scratch values tasks hand to
 * each other (frontier, anchor, selected supply, staged route) and the action
 * queue the pass produces.
 */
public class WorldSnapshot {
    
    private final Scenario scenario;
    private final Pathfinder pathfinder;
    private final Footprint footprint;
    
    private HeightGrid grid;
    private NavMesh navMesh;
    private Vec3 agentPos;
    private boolean carrying;
    private final List<PlannedAction> actions = new ArrayList<>();
    
    // Scratch
    private StepDefinition frontier;
    private Cell anchor;
    private PlannedStep pendingStep;
    private List<PlannedAction> pendingRoute = List.of();
    
    public WorldSnapshot(Scenario scenario, Pathfinder pathfinder, Footprint footprint,
                         HeightGrid grid, NavMesh navMesh, Vec3 agentPos, boolean carrying) {
        this.scenario = Objects.requireNonNull(scenario, "scenario");
        this.pathfinder = Objects.requireNonNull(pathfinder, "pathfinder");
        this.footprint = Objects.requireNonNull(footprint, "footprint");
        this.grid = grid.copy();
        this.navMesh = Objects.requireNonNull(navMesh, "navMesh");
        this.agentPos = Objects.requireNonNull(agentPos, "agentPos");
        this.carrying = carrying;
    }
    
    /**
     * Clones the live world into a fresh planning snapshot.
     */
    public static WorldSnapshot fromWorld(World world, Scenario scenario, Pathfinder pathfinder, Footprint footprint) {
        return new WorldSnapshot(scenario, pathfinder, footprint,
                world.getGrid(), world.getNavMesh(), world.getAgentPos(), world.isCarrying());
    }
    
    /**
     * @return the snapshot's simulated end state as a live world value
     */
    public World toWorld() {
        return new World(grid, agentPos, carrying, navMesh);
    }
    
    // ========== Simulated actions ==========
    
    /**
     * Removes the top block of a column into the agent's hands.
     */
    public void pick(Cell cell) {
        grid.decrement(cell);
        carrying = true;
        navMesh = pathfinder.rebuildNavMesh(grid);
    }
    
    /**
     * Drops the carried block on a column. Placing on the goal column lifts
     * the agent onto the new top.
     */
    public void place(Cell cell) {
        grid.increment(cell);
        carrying = false;
        navMesh = pathfinder.rebuildNavMesh(grid);
        if (cell.equals(scenario.getGoalCell())) {
            agentPos = grid.cellTop(cell);
        }
    }
    
    public void enqueue(PlannedAction action) {
        actions.add(Objects.requireNonNull(action));
    }
    
    /**
     * Enqueues the staged route and moves the agent to its last destination.
     */
    public void commitRoute() {
        for (PlannedAction action : pendingRoute) {
            enqueue(action);
            if (action.destination() != null) {
                agentPos = action.destination();
            }
        }
        pendingRoute = List.of();
    }
    
    // ========== Transactions ==========
    
    /**
     * Saved snapshot state. Holds its own grid copy so later mutation of the
     * snapshot cannot leak into it.
     */
    public static final class Checkpoint {
        private final HeightGrid grid;
        private final NavMesh navMesh;
        private final Vec3 agentPos;
        private final boolean carrying;
        private final int actionCount;
        private final StepDefinition frontier;
        private final Cell anchor;
        private final PlannedStep pendingStep;
        private final List<PlannedAction> pendingRoute;
        
        private Checkpoint(WorldSnapshot s) {
            this.grid = s.grid.copy();
            this.navMesh = s.navMesh;
            this.agentPos = s.agentPos;
            this.carrying = s.carrying;
            this.actionCount = s.actions.size();
            this.frontier = s.frontier;
            this.anchor = s.anchor;
            this.pendingStep = s.pendingStep;
            this.pendingRoute = s.pendingRoute;
        }
    }
    
    public Checkpoint checkpoint() {
        return new Checkpoint(this);
    }
    
    /**
     * Rolls back to a checkpoint taken from this snapshot, dropping any
     * actions enqueued since.
     */
    public void restore(Checkpoint checkpoint) {
        if (checkpoint.actionCount > actions.size()) {
            throw new IllegalStateException("Checkpoint is newer than the snapshot's action queue");
        }
        this.grid = checkpoint.grid.copy();
        this.navMesh = checkpoint.navMesh;
        this.agentPos = checkpoint.agentPos;
        this.carrying = checkpoint.carrying;
        this.actions.subList(checkpoint.actionCount, actions.size()).clear();
        this.frontier = checkpoint.frontier;
        this.anchor = checkpoint.anchor;
        this.pendingStep = checkpoint.pendingStep;
        this.pendingRoute = checkpoint.pendingRoute;
    }
    
    // ========== Getters / setters ==========
    
    public Scenario getScenario() { return scenario; }
    public Pathfinder getPathfinder() { return pathfinder; }
    public Footprint getFootprint() { return footprint; }
    
    /** The snapshot's own grid; effects mutate it in place. */
    public HeightGrid getGrid() { return grid; }
    public NavMesh getNavMesh() { return navMesh; }
    
    public Vec3 getAgentPos() { return agentPos; }
    public void setAgentPos(Vec3 agentPos) { this.agentPos = Objects.requireNonNull(agentPos); }
    
    public boolean isCarrying() { return carrying; }
    
    public List<PlannedAction> getActions() { return Collections.unmodifiableList(actions); }
    
    public StepDefinition getFrontier() { return frontier; }
    public void setFrontier(StepDefinition frontier) { this.frontier = frontier; }
    
    public Cell getAnchor() { return anchor; }
    public void setAnchor(Cell anchor) { this.anchor = anchor; }
    
    public PlannedStep getPendingStep() { return pendingStep; }
    public void setPendingStep(PlannedStep pendingStep) { this.pendingStep = pendingStep; }
    
    public List<PlannedAction> getPendingRoute() { return pendingRoute; }
    public void setPendingRoute(List<PlannedAction> pendingRoute) { this.pendingRoute = List.copyOf(pendingRoute); }
    
    @Override
    public String toString() {
        return "WorldSnapshot[agent=" + agentPos + ", carrying=" + carrying
                + ", actions=" + actions.size() + ", frontier=" + frontier + "]";
    }
}
