package stacker.planning.pathfinding;

import stacker.domain.HeightGrid;

/**
 * Fixed tuning data for navmesh generation. None of these values are
 * touched by planner logic; they only shape which surfaces are walkable
 * and which neighbouring surfaces are linked.
 */
public final class NavMeshOptions {
    
    /** Horizontal size of one walkable surface (one grid column) */
    public final double cellSize;
    
    /** Agent radius in world units */
    public final double walkableRadius;
    
    /** Largest height difference the agent can step up or down */
    public final double walkableClimb;
    
    /** Head room the agent needs above a surface */
    public final double walkableHeight;
    
    /** Steepest surface still considered walkable, in degrees */
    public final double walkableSlopeAngleDegrees;
    
    public NavMeshOptions(double cellSize, double walkableRadius, double walkableClimb,
                          double walkableHeight, double walkableSlopeAngleDegrees) {
        if (cellSize <= 0) {
            throw new IllegalArgumentException("Cell size must be positive: " + cellSize);
        }
        this.cellSize = cellSize;
        this.walkableRadius = walkableRadius;
        this.walkableClimb = walkableClimb;
        this.walkableHeight = walkableHeight;
        this.walkableSlopeAngleDegrees = walkableSlopeAngleDegrees;
    }
    
    /**
     * Block-world defaults: one surface per block column, a climb of 1.6
     * (one block up or down, never two) and a 45 degree slope limit.
     */
    public static NavMeshOptions defaults() {
        return new NavMeshOptions(HeightGrid.BLOCK_SIZE, 0.2, 1.6, 1.8, 45.0);
    }
    
    @Override
    public String toString() {
        return "NavMeshOptions[cell=" + cellSize + ", radius=" + walkableRadius + ", climb=" + walkableClimb
                + ", height=" + walkableHeight + ", slope=" + walkableSlopeAngleDegrees + "]";
    }
}
