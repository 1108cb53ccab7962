package stacker.domain;

import java.util.Objects;

/**
 * One step of the staircase: the cell must be built up to targetHeight.
 * An ordered list of these forms the staircase. Each step is checked on its
 * own; non-decreasing target heights are expected but not enforced.
 */
public final class StepDefinition {
    
    public final Cell cell;
    public final int targetHeight;
    public final String label;
    
    public StepDefinition(Cell cell, int targetHeight, String label) {
        this.cell = Objects.requireNonNull(cell, "Step cell cannot be null");
        if (targetHeight < 0) {
            throw new IllegalArgumentException("Target height must be non-negative: " + targetHeight);
        }
        this.targetHeight = targetHeight;
        this.label = Objects.requireNonNull(label, "Step label cannot be null");
    }
    
    public static StepDefinition of(int x, int z, int targetHeight, String label) {
        return new StepDefinition(Cell.of(x, z), targetHeight, label);
    }
    
    /**
     * @return true once the grid holds at least targetHeight blocks on this cell
     */
    public boolean isBuilt(HeightGrid grid) {
        return grid.get(cell) >= targetHeight;
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StepDefinition)) return false;
        StepDefinition other = (StepDefinition) obj;
        return targetHeight == other.targetHeight && cell.equals(other.cell) && label.equals(other.label);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(cell, targetHeight, label);
    }
    
    @Override
    public String toString() {
        return label + "[" + cell + " -> " + targetHeight + "]";
    }
}
