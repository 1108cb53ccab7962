package stacker.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlannedActionTest {
    
    @Test
    void navigateDestinationIsTarget() {
        Vec3 target = new Vec3(2.5, 1, 2.5);
        PlannedAction walk = PlannedAction.navigate(
                List.of(new Vec3(0.5, 0, 0.5), new Vec3(1.5, 0, 0.5), target), target, "Walk");
        
        assertTrue(walk.isNavigate());
        assertEquals(target, walk.destination());
        assertNull(walk.cell);
    }
    
    @Test
    void pickAndPlaceCarryTheirCell() {
        PlannedAction pick = PlannedAction.pick(Cell.of(1, 1), new Vec3(1.5, 3, 1.5), "Pick");
        PlannedAction place = PlannedAction.place(Cell.of(3, 2), new Vec3(3.5, 1, 2.5), "Place");
        
        assertTrue(pick.isPick());
        assertTrue(place.isPlace());
        assertEquals(Cell.of(1, 1), pick.cell);
        assertEquals(Cell.of(3, 2), place.cell);
        assertTrue(pick.path.isEmpty());
    }
    
    @Test
    void navigateRequiresPathAndTarget() {
        assertThrows(NullPointerException.class, () -> PlannedAction.navigate(null, new Vec3(0, 0, 0), "x"));
        assertThrows(NullPointerException.class, () -> PlannedAction.navigate(List.of(), null, "x"));
    }
}
