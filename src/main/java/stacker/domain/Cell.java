package stacker.domain;

/**
 * Immutable integer coordinate on the block grid.
 * x runs along the grid width, z along its depth; (0,0) is a corner.
 */
public final class Cell {
    
    /** Column index along the grid width */
    public final int x;
    
    /** Row index along the grid depth */
    public final int z;
    
    public Cell(int x, int z) {
        this.x = x;
        this.z = z;
    }
    
    /**
     * Factory alias for {@code new Cell(x, z)}; reads better in scenario tables.
     */
    public static Cell of(int x, int z) {
        return new Cell(x, z);
    }
    
    /**
     * Returns the cell one step away in the given direction.
     * The result may lie outside the grid; callers check bounds.
     * 
     * @param direction the direction to move
     * @return the neighbouring cell
     */
    public Cell move(Direction direction) {
        return new Cell(x + direction.dx, z + direction.dz);
    }
    
    /**
     * Manhattan distance |x1 - x2| + |z1 - z2|.
     */
    public int manhattanDistance(Cell other) {
        return Math.abs(this.x - other.x) + Math.abs(this.z - other.z);
    }
    
    /**
     * Checks if this cell shares an edge with another cell (no diagonals).
     * 
     * @param other the other cell
     * @return true if the cells are orthogonal neighbours
     */
    public boolean isCardinallyAdjacentTo(Cell other) {
        return manhattanDistance(other) == 1;
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Cell cell = (Cell) obj;
        return x == cell.x && z == cell.z;
    }
    
    @Override
    public int hashCode() {
        return 31 * x + z;
    }
    
    @Override
    public String toString() {
        return "(" + x + "," + z + ")";
    }
}
