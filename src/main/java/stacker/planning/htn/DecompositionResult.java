package stacker.planning.htn;

import java.util.List;

/**
 * Outcome of decomposing a root task: status plus the names of the primitive
 * tasks that make up the plan, in order.
 */
public final class DecompositionResult {
    
    public final TaskStatus status;
    public final List<String> taskNames;
    
    private DecompositionResult(TaskStatus status, List<String> taskNames) {
        this.status = status;
        this.taskNames = List.copyOf(taskNames);
    }
    
    public static DecompositionResult success(List<String> taskNames) {
        return new DecompositionResult(TaskStatus.SUCCESS, taskNames);
    }
    
    public static DecompositionResult failure(List<String> taskNames) {
        return new DecompositionResult(TaskStatus.FAILURE, taskNames);
    }
    
    public boolean isSuccess() {
        return status == TaskStatus.SUCCESS;
    }
    
    @Override
    public String toString() {
        return "DecompositionResult[" + status + ", " + taskNames + "]";
    }
}
