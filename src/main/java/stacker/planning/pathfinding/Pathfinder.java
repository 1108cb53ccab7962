package stacker.planning.pathfinding;

import stacker.domain.HeightGrid;
import stacker.domain.Vec3;

import java.util.List;

/**
 * Pathfinding oracle consumed by the planner.
 * 
 * Implementations must be deterministic for a fixed navmesh, and
 * {@link #rebuildNavMesh(HeightGrid)} must be a pure function of the grid:
 * the planner calls it speculatively on snapshot grids.
 * 
 * An unreachable goal is an ordinary result ({@link PathResult#failure()}),
 * never an exception.
 */
public interface Pathfinder {
    
    /**
     * Result of a path query.
     */
    class PathResult {
        public final boolean found;
        public final List<Vec3> waypoints;
        public final double length;
        
        private PathResult(boolean found, List<Vec3> waypoints, double length) {
            this.found = found;
            this.waypoints = waypoints;
            this.length = length;
        }
        
        public static PathResult success(List<Vec3> waypoints) {
            List<Vec3> copy = List.copyOf(waypoints);
            return new PathResult(true, copy, polylineLength(copy));
        }
        
        public static PathResult failure() {
            return new PathResult(false, List.of(), Double.POSITIVE_INFINITY);
        }
        
        /**
         * @return true when a path with at least one waypoint was found
         */
        public boolean isUsable() {
            return found && !waypoints.isEmpty();
        }
        
        @Override
        public String toString() {
            if (found) {
                return String.format(java.util.Locale.ROOT, "PathResult[length=%.2f, waypoints=%d]",
                        length, waypoints.size());
            }
            return "PathResult[NOT FOUND]";
        }
    }
    
    /**
     * Finds a walkable path between two world positions.
     * 
     * @param navMesh surfaces to walk on
     * @param start agent position
     * @param goal target position
     * @param footprint agent extents
     * @return waypoints from start to goal, or failure
     */
    PathResult findPath(NavMesh navMesh, Vec3 start, Vec3 goal, Footprint footprint);
    
    /**
     * Regenerates the navmesh after the grid changed.
     * 
     * @param grid current heights
     * @return navmesh consistent with the grid
     */
    NavMesh rebuildNavMesh(HeightGrid grid);
    
    /**
     * Sum of the distances between consecutive points.
     */
    static double polylineLength(List<Vec3> points) {
        double length = 0;
        for (int i = 1; i < points.size(); i++) {
            length += points.get(i - 1).distanceTo(points.get(i));
        }
        return length;
    }
}
