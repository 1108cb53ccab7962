package stacker.planning.pathfinding;

import stacker.domain.Cell;
import stacker.domain.Direction;
import stacker.domain.Vec3;

import java.util.ArrayList;
import java.util.List;

/**
 * Walkable surfaces of the block world, one per grid column, with links
 * between orthogonally adjacent surfaces whose height difference the agent
 * can climb. Immutable; regenerate it whenever the grid changes.
 */
public final class NavMesh {
    
    private final int width;
    private final int depth;
    
    /** Surface height per column; NaN where there is no walkable surface */
    private final double[][] surfaceY;
    
    private final NavMeshOptions options;
    
    NavMesh(int width, int depth, double[][] surfaceY, NavMeshOptions options) {
        this.width = width;
        this.depth = depth;
        this.surfaceY = surfaceY;
        this.options = options;
    }
    
    public int getWidth() { return width; }
    public int getDepth() { return depth; }
    public NavMeshOptions getOptions() { return options; }
    
    public boolean inBounds(Cell cell) {
        return cell.x >= 0 && cell.x < width && cell.z >= 0 && cell.z < depth;
    }
    
    /**
     * @return true if the column has a walkable top surface
     */
    public boolean hasSurface(Cell cell) {
        return inBounds(cell) && !Double.isNaN(surfaceY[cell.x][cell.z]);
    }
    
    /**
     * @return surface height of the column, NaN if none
     */
    public double surfaceHeight(Cell cell) {
        return inBounds(cell) ? surfaceY[cell.x][cell.z] : Double.NaN;
    }
    
    /**
     * Centre of a column's walkable surface.
     */
    public Vec3 surfaceCentre(Cell cell) {
        return new Vec3(
                (cell.x + 0.5) * options.cellSize,
                surfaceHeight(cell),
                (cell.z + 0.5) * options.cellSize);
    }
    
    /**
     * Checks if the agent can step directly between two adjacent surfaces.
     */
    public boolean isLinked(Cell from, Cell to) {
        if (!from.isCardinallyAdjacentTo(to)) return false;
        if (!hasSurface(from) || !hasSurface(to)) return false;
        return Math.abs(surfaceHeight(from) - surfaceHeight(to)) <= options.walkableClimb + 1e-9;
    }
    
    /**
     * Linked neighbours of a surface, in {@link Direction} order.
     */
    public List<Cell> linkedNeighbours(Cell cell) {
        List<Cell> result = new ArrayList<>(4);
        for (Direction dir : Direction.values()) {
            Cell next = cell.move(dir);
            if (isLinked(cell, next)) {
                result.add(next);
            }
        }
        return result;
    }
    
    @Override
    public String toString() {
        return "NavMesh[" + width + "x" + depth + ", climb=" + options.walkableClimb + "]";
    }
}
