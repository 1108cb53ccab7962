package stacker.planning.htn;

import java.util.Objects;

/**
 * Node of a task network: either a {@link CompoundTask} that combines
 * children, or a {@link PrimitiveTask} that tests conditions and changes the
 * planning snapshot.
 */
public abstract class Task {
    
    private final String name;
    
    protected Task(String name) {
        this.name = Objects.requireNonNull(name, "Task name cannot be null");
    }
    
    public String getName() {
        return name;
    }
    
    public abstract boolean isPrimitive();
    
    @Override
    public String toString() {
        return name;
    }
}
