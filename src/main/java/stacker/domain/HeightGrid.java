package stacker.domain;

import java.util.Arrays;

/**
 * Column heights of the block world: heights[x][z] is the number of blocks
 * stacked on cell (x, z).
 * 
 * The grid is mutable so that a planning snapshot can advance cheaply, but
 * only through {@link #increment(Cell)} and {@link #decrement(Cell)}; heights
 * never go negative. Use {@link #copy()} to hand out an independent grid.
 */
public final class HeightGrid {
    
    /** Edge length (and height) of one block in world units */
    public static final double BLOCK_SIZE = 1.0;
    
    private final int width;
    private final int depth;
    private final int[][] heights;
    
    /**
     * Creates an empty (all zero) grid.
     * 
     * @param width number of cells along x
     * @param depth number of cells along z
     */
    public HeightGrid(int width, int depth) {
        if (width <= 0 || depth <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + depth);
        }
        this.width = width;
        this.depth = depth;
        this.heights = new int[width][depth];
    }
    
    private HeightGrid(HeightGrid other) {
        this.width = other.width;
        this.depth = other.depth;
        this.heights = new int[width][];
        for (int x = 0; x < width; x++) {
            this.heights[x] = Arrays.copyOf(other.heights[x], depth);
        }
    }
    
    public int getWidth() { return width; }
    public int getDepth() { return depth; }
    
    public boolean inBounds(Cell cell) {
        return cell.x >= 0 && cell.x < width && cell.z >= 0 && cell.z < depth;
    }
    
    /**
     * @return number of blocks on the cell
     * @throws IndexOutOfBoundsException if the cell is outside the grid
     */
    public int get(Cell cell) {
        checkBounds(cell);
        return heights[cell.x][cell.z];
    }
    
    /**
     * Overwrites a column height. Used while seeding a scenario.
     */
    public void set(Cell cell, int height) {
        checkBounds(cell);
        if (height < 0) {
            throw new IllegalArgumentException("Height must be non-negative at " + cell + ": " + height);
        }
        heights[cell.x][cell.z] = height;
    }
    
    /** Place: one more block on the cell. */
    public void increment(Cell cell) {
        checkBounds(cell);
        heights[cell.x][cell.z]++;
    }
    
    /**
     * Pick: one block less on the cell.
     * 
     * @throws IllegalStateException if the cell is already empty
     */
    public void decrement(Cell cell) {
        checkBounds(cell);
        if (heights[cell.x][cell.z] == 0) {
            throw new IllegalStateException("Cannot take a block from empty cell " + cell);
        }
        heights[cell.x][cell.z]--;
    }
    
    /**
     * World position of the centre of the cell's top face.
     */
    public Vec3 cellTop(Cell cell) {
        return new Vec3(
                cell.x * BLOCK_SIZE + BLOCK_SIZE / 2,
                get(cell) * BLOCK_SIZE,
                cell.z * BLOCK_SIZE + BLOCK_SIZE / 2);
    }
    
    /**
     * Cell containing a world position (floor of each horizontal coordinate).
     */
    public static Cell cellAt(Vec3 position) {
        return new Cell(
                (int) Math.floor(position.x / BLOCK_SIZE),
                (int) Math.floor(position.z / BLOCK_SIZE));
    }
    
    /**
     * Height of a world position in whole blocks.
     */
    public static int blockLevel(Vec3 position) {
        return (int) Math.floor(position.y / BLOCK_SIZE);
    }
    
    /**
     * @return sum of all column heights
     */
    public int totalBlocks() {
        int total = 0;
        for (int[] column : heights) {
            for (int h : column) {
                total += h;
            }
        }
        return total;
    }
    
    /**
     * @return an independent deep copy of this grid
     */
    public HeightGrid copy() {
        return new HeightGrid(this);
    }
    
    /**
     * Renders the grid with one text row per z, one digit per x.
     * Heights above 9 are shown as '+'; empty cells as '.'.
     */
    public String toGridString() {
        StringBuilder sb = new StringBuilder();
        for (int z = 0; z < depth; z++) {
            for (int x = 0; x < width; x++) {
                int h = heights[x][z];
                if (h == 0) {
                    sb.append('.');
                } else if (h > 9) {
                    sb.append('+');
                } else {
                    sb.append((char) ('0' + h));
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }
    
    private void checkBounds(Cell cell) {
        if (!inBounds(cell)) {
            throw new IndexOutOfBoundsException("Cell " + cell + " outside " + width + "x" + depth + " grid");
        }
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof HeightGrid)) return false;
        HeightGrid other = (HeightGrid) obj;
        return width == other.width && depth == other.depth && Arrays.deepEquals(heights, other.heights);
    }
    
    @Override
    public int hashCode() {
        return Arrays.deepHashCode(heights);
    }
    
    @Override
    public String toString() {
        return "HeightGrid[" + width + "x" + depth + ", blocks=" + totalBlocks() + "]";
    }
}
