package stacker.planning.selection;

import stacker.domain.Cell;
import stacker.domain.StepDefinition;
import stacker.domain.Vec3;

import java.util.List;

/**
 * Outcome of supply selection for one planning pass: which stack to take a
 * block from, where to stand while doing it, and how to get there.
 */
public final class PlannedStep {
    
    public final Cell supply;
    public final Vec3 supplyTop;
    public final Cell stand;
    public final Vec3 standTop;
    public final StepDefinition frontier;
    
    /** Fallback staging cell when direct adjacent placement is impossible */
    public final Cell anchor;
    
    public final List<Vec3> pathToStand;
    public final double pathLength;
    
    public PlannedStep(Cell supply, Vec3 supplyTop, Cell stand, Vec3 standTop,
                       StepDefinition frontier, Cell anchor, List<Vec3> pathToStand, double pathLength) {
        this.supply = supply;
        this.supplyTop = supplyTop;
        this.stand = stand;
        this.standTop = standTop;
        this.frontier = frontier;
        this.anchor = anchor;
        this.pathToStand = List.copyOf(pathToStand);
        this.pathLength = pathLength;
    }
    
    @Override
    public String toString() {
        return "PlannedStep[" + frontier.label + ": supply " + supply + " from " + stand
                + ", anchor " + anchor + ", path " + pathToStand.size() + " waypoints]";
    }
}
