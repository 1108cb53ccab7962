package stacker.planning.selection;

import stacker.domain.*;
import stacker.planning.SearchConfig;
import stacker.planning.pathfinding.Footprint;
import stacker.planning.pathfinding.NavMesh;
import stacker.planning.pathfinding.Pathfinder;
import stacker.planning.pathfinding.Pathfinder.PathResult;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Chooses the supply stack to fetch the next block from.
 * 
 * Nearest reachable first: for every stocked supply, every in-bounds
 * orthogonal neighbour is a candidate stand cell; the agent's path length to
 * the stand's top decides. Ties keep the earlier candidate, so neighbour scan
 * order and supply declaration order break them. The choice ignores what
 * later steps will need.
 */
public class SupplySelector {
    
    private final Pathfinder pathfinder;
    private final Footprint footprint;
    
    public SupplySelector(Pathfinder pathfinder, Footprint footprint) {
        this.pathfinder = Objects.requireNonNull(pathfinder, "pathfinder");
        this.footprint = Objects.requireNonNull(footprint, "footprint");
    }
    
    /**
     * @param grid current heights
     * @param navMesh navmesh consistent with grid
     * @param agentPos where the agent stands
     * @param steps the staircase
     * @param supplies declared supply stacks
     * @param startCell anchor for the first step
     * @return the selection, or null when nothing is left to build or no stocked supply can be approached
     */
    public PlannedStep chooseSupply(HeightGrid grid, NavMesh navMesh, Vec3 agentPos,
                                    List<StepDefinition> steps, List<SupplySource> supplies, Cell startCell) {
        Optional<StepDefinition> frontierOpt = FrontierSelector.frontier(grid, steps);
        if (frontierOpt.isEmpty()) {
            logVerbose("chooseSupply: no frontier steps remaining");
            return null;
        }
        StepDefinition frontier = frontierOpt.get();
        Cell anchor = FrontierSelector.anchorFor(steps, frontier, startCell);
        logVerbose("chooseSupply: evaluating frontier " + frontier.label + " (height "
                + grid.get(frontier.cell) + "/" + frontier.targetHeight + ") from " + agentPos);
        
        PlannedStep best = null;
        for (SupplySource source : supplies) {
            Cell supply = source.cell;
            if (grid.get(supply) <= 0) {
                logVerbose("chooseSupply: skipping empty supply " + supply);
                continue;
            }
            
            Cell bestStand = null;
            PathResult bestPath = null;
            for (Direction dir : Direction.values()) {
                Cell stand = supply.move(dir);
                if (!grid.inBounds(stand)) continue;
                
                PathResult path = pathfinder.findPath(navMesh, agentPos, grid.cellTop(stand), footprint);
                if (!path.isUsable()) {
                    logVerbose("chooseSupply: stand " + stand + " for supply " + supply + " unreachable");
                    continue;
                }
                if (bestPath == null || path.length < bestPath.length) {
                    bestStand = stand;
                    bestPath = path;
                }
            }
            
            if (bestPath == null) {
                logVerbose("chooseSupply: no adjacent stand reachable for supply " + supply);
                continue;
            }
            if (best == null || bestPath.length < best.pathLength) {
                best = new PlannedStep(supply, grid.cellTop(supply), bestStand, grid.cellTop(bestStand),
                        frontier, anchor, bestPath.waypoints, bestPath.length);
            }
        }
        
        if (best == null) {
            if (SearchConfig.isNormal()) {
                System.err.println("[SupplySelector] No reachable supplies for " + frontier.label
                        + " from " + agentPos);
            }
        } else {
            logVerbose("chooseSupply: selected " + best);
        }
        return best;
    }
    
    private void logVerbose(String msg) {
        if (SearchConfig.isVerbose()) System.err.println("[SupplySelector] " + msg);
    }
}
