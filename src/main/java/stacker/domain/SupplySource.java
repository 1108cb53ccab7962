package stacker.domain;

import java.util.Objects;

/**
 * A stack of loose blocks the agent may take from.
 * height is the initial stock; what remains is whatever the grid holds there.
 */
public final class SupplySource {
    
    public final Cell cell;
    public final int height;
    
    public SupplySource(Cell cell, int height) {
        this.cell = Objects.requireNonNull(cell, "Supply cell cannot be null");
        if (height < 0) {
            throw new IllegalArgumentException("Supply height must be non-negative: " + height);
        }
        this.height = height;
    }
    
    public static SupplySource of(int x, int z, int height) {
        return new SupplySource(Cell.of(x, z), height);
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SupplySource)) return false;
        SupplySource other = (SupplySource) obj;
        return height == other.height && cell.equals(other.cell);
    }
    
    @Override
    public int hashCode() {
        return 31 * cell.hashCode() + height;
    }
    
    @Override
    public String toString() {
        return "Supply[" + cell + " x" + height + "]";
    }
}
