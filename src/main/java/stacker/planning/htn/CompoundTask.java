package stacker.planning.htn;

import java.util.List;

/**
 * A task made of subtasks.
 * 
 * Combinators:
 * - Sequence: every child must succeed, in order, each seeing the snapshot
 *             as the previous child left it
 * - Select: children are tried in order; the first success wins
 */
public final class CompoundTask extends Task {
    
    public enum Combinator {
        SEQUENCE,
        SELECT
    }
    
    private final Combinator combinator;
    private final List<Task> children;
    
    public CompoundTask(String name, Combinator combinator, List<Task> children) {
        super(name);
        this.combinator = combinator;
        this.children = List.copyOf(children);
    }
    
    public static CompoundTask sequence(String name, Task... children) {
        return new CompoundTask(name, Combinator.SEQUENCE, List.of(children));
    }
    
    public static CompoundTask select(String name, Task... children) {
        return new CompoundTask(name, Combinator.SELECT, List.of(children));
    }
    
    public Combinator getCombinator() { return combinator; }
    public List<Task> getChildren() { return children; }
    
    @Override
    public boolean isPrimitive() {
        return false;
    }
    
    @Override
    public String toString() {
        return combinator + "(" + getName() + ", " + children.size() + " children)";
    }
}
