package stacker.domain;

/**
 * The four orthogonal directions on the block grid.
 * Declaration order is the scan order used by every neighbour search,
 * so results that depend on "first found" are deterministic.
 */
public enum Direction {
    /** East - increase x */
    POS_X(1, 0),
    
    /** West - decrease x */
    NEG_X(-1, 0),
    
    /** South - increase z */
    POS_Z(0, 1),
    
    /** North - decrease z */
    NEG_Z(0, -1);
    
    /** X delta when moving in this direction */
    public final int dx;
    
    /** Z delta when moving in this direction */
    public final int dz;
    
    Direction(int dx, int dz) {
        this.dx = dx;
        this.dz = dz;
    }
}
