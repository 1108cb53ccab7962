package stacker.planning.htn;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A leaf task: conditions checked in order, then the operator, then the
 * effect on the planning snapshot.
 * 
 * Effects only ever touch the snapshot they are given. The live world is
 * changed by replaying the emitted actions once the whole plan is accepted.
 */
public final class PrimitiveTask extends Task {
    
    private static final Function<WorldSnapshot, TaskStatus> ALWAYS_SUCCEEDS = s -> TaskStatus.SUCCESS;
    
    private final List<Condition> conditions;
    private final Function<WorldSnapshot, TaskStatus> operator;
    private final Consumer<WorldSnapshot> effect;
    
    /**
     * @param name task name, shown in decomposition traces
     * @param conditions preconditions, evaluated in order
     * @param operator body; null means it always succeeds
     * @param effect snapshot mutation; null for none
     */
    public PrimitiveTask(String name, List<Condition> conditions,
                         Function<WorldSnapshot, TaskStatus> operator, Consumer<WorldSnapshot> effect) {
        super(name);
        this.conditions = List.copyOf(conditions);
        this.operator = operator != null ? operator : ALWAYS_SUCCEEDS;
        this.effect = effect;
    }
    
    /**
     * Primitive with conditions and an effect, whose operator always succeeds.
     */
    public static PrimitiveTask of(String name, List<Condition> conditions, Consumer<WorldSnapshot> effect) {
        return new PrimitiveTask(name, conditions, null, effect);
    }
    
    public List<Condition> getConditions() { return conditions; }
    
    /**
     * @return the first condition that does not hold, or null if all hold
     */
    Condition firstUnmetCondition(WorldSnapshot snapshot) {
        for (Condition condition : conditions) {
            if (!condition.isMet(snapshot)) {
                return condition;
            }
        }
        return null;
    }
    
    TaskStatus runOperator(WorldSnapshot snapshot) {
        return Objects.requireNonNullElse(operator.apply(snapshot), TaskStatus.FAILURE);
    }
    
    void applyEffect(WorldSnapshot snapshot) {
        if (effect != null) {
            effect.accept(snapshot);
        }
    }
    
    @Override
    public boolean isPrimitive() {
        return true;
    }
}
