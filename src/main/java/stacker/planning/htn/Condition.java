package stacker.planning.htn;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A named precondition of a primitive task.
 * 
 * A condition may stash what it computed (a path, a selected supply) on the
 * snapshot for the task's effect to use; it must not change the world part
 * of the snapshot.
 */
public final class Condition {
    
    private final String name;
    private final Predicate<WorldSnapshot> test;
    
    public Condition(String name, Predicate<WorldSnapshot> test) {
        this.name = Objects.requireNonNull(name);
        this.test = Objects.requireNonNull(test);
    }
    
    public static Condition of(String name, Predicate<WorldSnapshot> test) {
        return new Condition(name, test);
    }
    
    public boolean isMet(WorldSnapshot snapshot) {
        return test.test(snapshot);
    }
    
    public String getName() {
        return name;
    }
    
    @Override
    public String toString() {
        return name;
    }
}
