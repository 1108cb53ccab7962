package stacker.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HeightGridTest {
    
    @Test
    void newGridIsEmpty() {
        HeightGrid grid = new HeightGrid(4, 3);
        assertEquals(0, grid.totalBlocks());
        assertEquals(0, grid.get(Cell.of(3, 2)));
    }
    
    @Test
    void pickFromEmptyCellFails() {
        HeightGrid grid = new HeightGrid(4, 4);
        assertThrows(IllegalStateException.class, () -> grid.decrement(Cell.of(1, 1)));
    }
    
    @Test
    void incrementAndDecrementChangeOneColumn() {
        HeightGrid grid = new HeightGrid(4, 4);
        grid.increment(Cell.of(1, 2));
        grid.increment(Cell.of(1, 2));
        grid.decrement(Cell.of(1, 2));
        
        assertEquals(1, grid.get(Cell.of(1, 2)));
        assertEquals(1, grid.totalBlocks());
    }
    
    @Test
    void rejectsNegativeHeightsAndOutOfBoundsCells() {
        HeightGrid grid = new HeightGrid(4, 4);
        assertThrows(IllegalArgumentException.class, () -> grid.set(Cell.of(0, 0), -1));
        assertThrows(IndexOutOfBoundsException.class, () -> grid.get(Cell.of(4, 0)));
        assertThrows(IndexOutOfBoundsException.class, () -> grid.increment(Cell.of(0, -1)));
        assertThrows(IllegalArgumentException.class, () -> new HeightGrid(0, 4));
    }
    
    @Test
    void cellTopIsCentreOfTopFace() {
        HeightGrid grid = new HeightGrid(8, 8);
        grid.set(Cell.of(3, 6), 5);
        
        assertEquals(new Vec3(3.5, 5.0, 6.5), grid.cellTop(Cell.of(3, 6)));
        assertEquals(new Vec3(0.5, 0.0, 0.5), grid.cellTop(Cell.of(0, 0)));
        assertEquals(Cell.of(3, 6), HeightGrid.cellAt(grid.cellTop(Cell.of(3, 6))));
        assertEquals(5, HeightGrid.blockLevel(grid.cellTop(Cell.of(3, 6))));
    }
    
    @Test
    void copyIsIndependent() {
        HeightGrid grid = new HeightGrid(3, 3);
        grid.set(Cell.of(1, 1), 2);
        HeightGrid copy = grid.copy();
        copy.increment(Cell.of(1, 1));
        
        assertEquals(2, grid.get(Cell.of(1, 1)));
        assertEquals(3, copy.get(Cell.of(1, 1)));
        assertNotEquals(grid, copy);
    }
    
    @Test
    void rendersOneRowPerZ() {
        HeightGrid grid = new HeightGrid(3, 2);
        grid.set(Cell.of(0, 0), 1);
        grid.set(Cell.of(2, 1), 12);
        
        assertEquals("1..\n..+\n", grid.toGridString());
    }
}
