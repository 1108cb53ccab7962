package stacker.planning.selection;

import stacker.domain.Cell;
import stacker.domain.Vec3;

import java.util.List;

/**
 * A walk to a cell next to the frontier from which the carried block can be
 * placed directly.
 */
public final class AdjacentMove {
    
    public final List<Vec3> path;
    public final Vec3 targetPos;
    public final Cell adjacentCell;
    public final int targetHeight;
    public final int adjacentHeight;
    
    public AdjacentMove(List<Vec3> path, Vec3 targetPos, Cell adjacentCell, int targetHeight, int adjacentHeight) {
        this.path = List.copyOf(path);
        this.targetPos = targetPos;
        this.adjacentCell = adjacentCell;
        this.targetHeight = targetHeight;
        this.adjacentHeight = adjacentHeight;
    }
    
    @Override
    public String toString() {
        return "AdjacentMove[" + adjacentCell + " at height " + targetHeight + "]";
    }
}
