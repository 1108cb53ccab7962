package stacker.domain;

import java.util.List;
import java.util.Objects;

/**
 * A primitive action emitted by the planner.
 * 
 * Action types:
 * - Navigate: walk along a waypoint path and end at target
 * - Pick: take the top block of cell (agent must not be carrying)
 * - Place: put the carried block on top of cell
 * 
 * Every action carries a human-readable description for the execution layer.
 * Instances are immutable; an ordered list of them is a plan.
 */
public final class PlannedAction {
    
    /**
     * Enum representing the type of action.
     */
    public enum ActionType {
        NAVIGATE,
        PICK,
        PLACE
    }
    
    /** The type of this action */
    public final ActionType type;
    
    /** Human-readable description */
    public final String description;
    
    /** Waypoints from the agent to the target (Navigate only, empty otherwise) */
    public final List<Vec3> path;
    
    /** Where the agent ends up (Navigate), or the top of the affected stack (Pick/Place) */
    public final Vec3 position;
    
    /** The stack that is picked from or placed on (null for Navigate) */
    public final Cell cell;
    
    private PlannedAction(ActionType type, String description, List<Vec3> path, Vec3 position, Cell cell) {
        this.type = type;
        this.description = description;
        this.path = path;
        this.position = position;
        this.cell = cell;
    }
    
    /**
     * Creates a Navigate action.
     * 
     * @param path waypoints, copied
     * @param target final agent position
     * @param description what the walk is for
     */
    public static PlannedAction navigate(List<Vec3> path, Vec3 target, String description) {
        Objects.requireNonNull(path, "Path cannot be null for Navigate action");
        Objects.requireNonNull(target, "Target cannot be null for Navigate action");
        return new PlannedAction(ActionType.NAVIGATE, description, List.copyOf(path), target, null);
    }
    
    /**
     * Creates a Pick action.
     * 
     * @param cell the supply stack
     * @param worldPosition top of the stack before the pick
     */
    public static PlannedAction pick(Cell cell, Vec3 worldPosition, String description) {
        Objects.requireNonNull(cell, "Cell cannot be null for Pick action");
        return new PlannedAction(ActionType.PICK, description, List.of(), worldPosition, cell);
    }
    
    /**
     * Creates a Place action.
     * 
     * @param cell the stack that grows
     * @param worldPosition top of the stack after the place
     */
    public static PlannedAction place(Cell cell, Vec3 worldPosition, String description) {
        Objects.requireNonNull(cell, "Cell cannot be null for Place action");
        return new PlannedAction(ActionType.PLACE, description, List.of(), worldPosition, cell);
    }
    
    public boolean isNavigate() { return type == ActionType.NAVIGATE; }
    public boolean isPick() { return type == ActionType.PICK; }
    public boolean isPlace() { return type == ActionType.PLACE; }
    
    /**
     * Destination of a Navigate: the target, or the last waypoint if the target is missing.
     */
    public Vec3 destination() {
        if (position != null) return position;
        return path.isEmpty() ? null : path.get(path.size() - 1);
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        PlannedAction other = (PlannedAction) obj;
        return type == other.type
                && Objects.equals(description, other.description)
                && path.equals(other.path)
                && Objects.equals(position, other.position)
                && Objects.equals(cell, other.cell);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(type, description, path, position, cell);
    }
    
    @Override
    public String toString() {
        return switch (type) {
            case NAVIGATE -> "Navigate(" + position + ", " + path.size() + " waypoints) " + description;
            case PICK -> "Pick" + cell + " " + description;
            case PLACE -> "Place" + cell + " " + description;
        };
    }
}
