package stacker.planning.selection;

import stacker.domain.*;
import stacker.planning.SearchConfig;
import stacker.planning.pathfinding.Footprint;
import stacker.planning.pathfinding.NavMesh;
import stacker.planning.pathfinding.Pathfinder;
import stacker.planning.pathfinding.Pathfinder.PathResult;

import java.util.Objects;

/**
 * Decides whether a carried block can go straight onto the frontier from
 * where the agent stands, and if not, where to stand so that it can.
 * 
 * The agent places onto an orthogonally adjacent column whose top is level
 * with its feet or one block below them.
 */
public class PlacementAdvisor {
    
    private final Pathfinder pathfinder;
    private final Footprint footprint;
    
    public PlacementAdvisor(Pathfinder pathfinder, Footprint footprint) {
        this.pathfinder = Objects.requireNonNull(pathfinder, "pathfinder");
        this.footprint = Objects.requireNonNull(footprint, "footprint");
    }
    
    /**
     * @return true if the agent carries a block, stands next to the frontier,
     *         and its height is between the frontier height and one above it
     */
    public static boolean canPlaceDirectlyOnAdjacent(HeightGrid grid, Vec3 agentPos, boolean carrying,
                                                     Cell frontierCell) {
        if (!carrying) return false;
        Cell agentCell = HeightGrid.cellAt(agentPos);
        if (!agentCell.isCardinallyAdjacentTo(frontierCell)) return false;
        
        int agentHeight = HeightGrid.blockLevel(agentPos);
        int frontierHeight = grid.get(frontierCell);
        return agentHeight >= frontierHeight && agentHeight <= frontierHeight + 1;
    }
    
    /**
     * Scans the frontier's neighbours for a reachable spot to place from.
     * 
     * @return the first neighbour (in direction order) the agent can walk to
     *         at a placement-compatible height, or null
     */
    public AdjacentMove findAdjacentPlacementMove(HeightGrid grid, NavMesh navMesh, Vec3 agentPos,
                                                  Cell frontierCell) {
        int frontierHeight = grid.get(frontierCell);
        for (Direction dir : Direction.values()) {
            Cell adjacent = frontierCell.move(dir);
            if (!grid.inBounds(adjacent)) continue;
            
            int adjacentHeight = grid.get(adjacent);
            int targetHeight = Math.max(adjacentHeight, frontierHeight);
            if (targetHeight > adjacentHeight + 1) continue;
            if (targetHeight < frontierHeight || targetHeight > frontierHeight + 1) continue;
            
            Vec3 targetPos = grid.cellTop(adjacent).withY(targetHeight * HeightGrid.BLOCK_SIZE);
            PathResult path = pathfinder.findPath(navMesh, agentPos, targetPos, footprint);
            if (!path.isUsable()) continue;
            
            if (SearchConfig.isVerbose()) {
                System.err.println("[PlacementAdvisor] Adjacent placement from " + adjacent
                        + " (height " + adjacentHeight + ", stand at " + targetHeight
                        + ", frontier " + frontierHeight + ")");
            }
            return new AdjacentMove(path.waypoints, targetPos, adjacent, targetHeight, adjacentHeight);
        }
        return null;
    }
}
