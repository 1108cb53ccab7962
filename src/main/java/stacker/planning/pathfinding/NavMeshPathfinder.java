package stacker.planning.pathfinding;

import stacker.domain.Cell;
import stacker.domain.HeightGrid;
import stacker.domain.Vec3;
import stacker.planning.SearchConfig;

import java.util.*;

/**
 * A* over navmesh surfaces.
 * 
 * Start and goal points snap onto the surface of the column that contains
 * them, but only when they lie within the footprint's vertical half extent
 * of that surface; a point hovering a full block above a column finds no
 * surface and the query fails. Moves are orthogonal steps between linked
 * surfaces, costed by 3D distance between surface centres.
 * 
 * The search is bounded by a number of node expansions; hitting the bound
 * reports the goal as unreachable.
 */
public class NavMeshPathfinder implements Pathfinder {
    
    private final NavMeshOptions options;
    private final int maxExpansions;
    
    public NavMeshPathfinder() {
        this(NavMeshOptions.defaults(), SearchConfig.DEFAULT_MAX_PATH_EXPANSIONS);
    }
    
    public NavMeshPathfinder(NavMeshOptions options, int maxExpansions) {
        this.options = Objects.requireNonNull(options, "options");
        if (maxExpansions <= 0) {
            throw new IllegalArgumentException("maxExpansions must be positive: " + maxExpansions);
        }
        this.maxExpansions = maxExpansions;
    }
    
    public NavMeshOptions getOptions() { return options; }
    public int getMaxExpansions() { return maxExpansions; }
    
    @Override
    public NavMesh rebuildNavMesh(HeightGrid grid) {
        return NavMeshBuilder.generate(GridGeometry.build(grid), options);
    }
    
    @Override
    public PathResult findPath(NavMesh navMesh, Vec3 start, Vec3 goal, Footprint footprint) {
        Cell startCell = snap(navMesh, start, footprint);
        Cell goalCell = snap(navMesh, goal, footprint);
        if (startCell == null || goalCell == null) {
            return PathResult.failure();
        }
        if (startCell.equals(goalCell)) {
            return PathResult.success(List.of(start, goal));
        }
        
        PriorityQueue<SearchNode> open = new PriorityQueue<>();
        Map<Cell, Double> bestG = new HashMap<>();
        Set<Cell> closed = new HashSet<>();
        long sequence = 0;
        
        open.add(new SearchNode(startCell, null, 0, estimate(navMesh, startCell, goalCell), sequence++));
        bestG.put(startCell, 0.0);
        
        int explored = 0;
        
        while (!open.isEmpty() && explored < maxExpansions) {
            SearchNode current = open.poll();
            if (!closed.add(current.cell)) continue;
            explored++;
            
            if (current.cell.equals(goalCell)) {
                return PathResult.success(reconstructPath(navMesh, current, start, goal));
            }
            
            Vec3 from = navMesh.surfaceCentre(current.cell);
            for (Cell next : navMesh.linkedNeighbours(current.cell)) {
                if (closed.contains(next)) continue;
                double newG = current.g + from.distanceTo(navMesh.surfaceCentre(next));
                
                Double existingG = bestG.get(next);
                if (existingG != null && existingG <= newG) continue;
                
                bestG.put(next, newG);
                open.add(new SearchNode(next, current, newG, estimate(navMesh, next, goalCell), sequence++));
            }
        }
        
        if (explored >= maxExpansions && SearchConfig.isVerbose()) {
            System.err.println("[NavMeshPathfinder] Expansion limit " + maxExpansions
                    + " hit searching " + startCell + " -> " + goalCell);
        }
        return PathResult.failure();
    }
    
    /**
     * Finds the surface a point stands on, or null if there is none close enough.
     */
    private Cell snap(NavMesh navMesh, Vec3 point, Footprint footprint) {
        Cell cell = new Cell(
                (int) Math.floor(point.x / navMesh.getOptions().cellSize),
                (int) Math.floor(point.z / navMesh.getOptions().cellSize));
        if (!navMesh.hasSurface(cell)) return null;
        double dy = Math.abs(point.y - navMesh.surfaceHeight(cell));
        return dy <= footprint.halfY + 1e-9 ? cell : null;
    }
    
    private double estimate(NavMesh navMesh, Cell from, Cell to) {
        return navMesh.surfaceCentre(from).horizontalDistanceTo(navMesh.surfaceCentre(to));
    }
    
    private List<Vec3> reconstructPath(NavMesh navMesh, SearchNode node, Vec3 start, Vec3 goal) {
        List<Vec3> path = new ArrayList<>();
        path.add(goal);
        node = node.parent;
        while (node != null && node.parent != null) {
            path.add(navMesh.surfaceCentre(node.cell));
            node = node.parent;
        }
        path.add(start);
        Collections.reverse(path);
        return path;
    }
    
    // ============ Internal Classes ============
    
    private static class SearchNode implements Comparable<SearchNode> {
        final Cell cell;
        final SearchNode parent;
        final double g;
        final double f;
        final long sequence;
        
        SearchNode(Cell cell, SearchNode parent, double g, double h, long sequence) {
            this.cell = cell;
            this.parent = parent;
            this.g = g;
            this.f = g + h;
            this.sequence = sequence;
        }
        
        @Override
        public int compareTo(SearchNode other) {
            int fCmp = Double.compare(this.f, other.f);
            if (fCmp != 0) return fCmp;
            int gCmp = Double.compare(other.g, this.g); // Prefer deeper
            if (gCmp != 0) return gCmp;
            return Long.compare(this.sequence, other.sequence);
        }
    }
}
