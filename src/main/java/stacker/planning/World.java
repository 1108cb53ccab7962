package stacker.planning;

import stacker.domain.Cell;
import stacker.domain.HeightGrid;
import stacker.domain.PlannedAction;
import stacker.domain.Vec3;
import stacker.planning.pathfinding.NavMesh;
import stacker.planning.pathfinding.Pathfinder;

import java.util.Objects;

/**
 * The authoritative block world between planning passes: heights, agent
 * position, whether a block is held, and the matching navmesh.
 * 
 * Immutable. Applying an action yields a new World; the runner swaps its
 * reference only after a whole plan has been replayed, so no half-applied
 * plan is ever visible.
 */
public final class World {
    
    private final HeightGrid grid;
    private final Vec3 agentPos;
    private final boolean carrying;
    private final NavMesh navMesh;
    
    public World(HeightGrid grid, Vec3 agentPos, boolean carrying, NavMesh navMesh) {
        this.grid = Objects.requireNonNull(grid, "grid").copy();
        this.agentPos = Objects.requireNonNull(agentPos, "agentPos");
        this.carrying = carrying;
        this.navMesh = Objects.requireNonNull(navMesh, "navMesh");
    }
    
    /**
     * Private constructor for internal use (avoids copying when the grid is already owned).
     */
    private World(HeightGrid grid, Vec3 agentPos, boolean carrying, NavMesh navMesh, boolean noCopy) {
        this.grid = grid;
        this.agentPos = agentPos;
        this.carrying = carrying;
        this.navMesh = navMesh;
    }
    
    /**
     * Creates the starting world: agent on top of the start cell.
     */
    public static World initial(HeightGrid grid, Cell startCell, boolean carrying, Pathfinder pathfinder) {
        return new World(grid, grid.cellTop(startCell), carrying, pathfinder.rebuildNavMesh(grid));
    }
    
    /** @return a copy of the heights; the world itself cannot be changed through it */
    public HeightGrid getGrid() { return grid.copy(); }
    
    public int heightAt(Cell cell) { return grid.get(cell); }
    public Vec3 getAgentPos() { return agentPos; }
    public boolean isCarrying() { return carrying; }
    public NavMesh getNavMesh() { return navMesh; }
    
    /**
     * Blocks in the world, counting the one in the agent's hands.
     */
    public int totalBlocks() {
        return grid.totalBlocks() + (carrying ? 1 : 0);
    }
    
    /**
     * Replays one planned action.
     * 
     * Navigate moves the agent to the action's destination. Pick and Place
     * change one column by one block, toggle carrying and rebuild the
     * navmesh. A Place on the goal column lifts the agent onto the new top.
     * 
     * @param action the action to apply
     * @param pathfinder source of the rebuilt navmesh
     * @param goalCell the goal column
     * @return the successor world
     */
    public World apply(PlannedAction action, Pathfinder pathfinder, Cell goalCell) {
        switch (action.type) {
            case NAVIGATE: {
                Vec3 destination = action.destination();
                return destination == null ? this : new World(grid, destination, carrying, navMesh, true);
            }
            case PICK: {
                HeightGrid next = grid.copy();
                next.decrement(action.cell);
                return new World(next, agentPos, true, pathfinder.rebuildNavMesh(next), true);
            }
            case PLACE: {
                HeightGrid next = grid.copy();
                next.increment(action.cell);
                Vec3 pos = action.cell.equals(goalCell) ? next.cellTop(goalCell) : agentPos;
                return new World(next, pos, false, pathfinder.rebuildNavMesh(next), true);
            }
            default:
                throw new IllegalArgumentException("Unknown action type: " + action.type);
        }
    }
    
    @Override
    public String toString() {
        return "World[agent=" + agentPos + ", carrying=" + carrying + ", blocks=" + grid.totalBlocks() + "]";
    }
}
