package stacker.planning.pathfinding;

/**
 * Agent collision extents used by path queries. The vertical half extent
 * decides how far a query point may sit above or below a surface and still
 * snap onto it.
 */
public final class Footprint {
    
    /** Default agent: 0.6 wide, 1.2 tall */
    public static final Footprint AGENT = new Footprint(0.3, 0.6, 0.3);
    
    public final double halfX;
    public final double halfY;
    public final double halfZ;
    
    public Footprint(double halfX, double halfY, double halfZ) {
        if (halfX < 0 || halfY < 0 || halfZ < 0) {
            throw new IllegalArgumentException("Half extents must be non-negative");
        }
        this.halfX = halfX;
        this.halfY = halfY;
        this.halfZ = halfZ;
    }
    
    @Override
    public String toString() {
        return "Footprint[" + halfX + ", " + halfY + ", " + halfZ + "]";
    }
}
