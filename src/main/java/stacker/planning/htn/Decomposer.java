package stacker.planning.htn;

import stacker.planning.SearchConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first decomposition of a task network against a planning snapshot.
 * 
 * Primitive: conditions in order (first false fails the task), then the
 * operator, then the effect. Sequence: children in order, first failure
 * fails. Select: children in order, first success wins.
 * 
 * With transactional sequences (the default) a failing Sequence, and a
 * failing Select alternative, are rolled back: the snapshot and action queue
 * return to what they were before the branch was entered. Without them,
 * effects of earlier children survive a later sibling's failure.
 */
public class Decomposer {
    
    private final boolean transactional;
    private final int maxDepth;
    
    public Decomposer(SearchConfig config) {
        this(config.isTransactionalSequences(), SearchConfig.MAX_DECOMPOSITION_DEPTH);
    }
    
    public Decomposer(boolean transactional, int maxDepth) {
        this.transactional = transactional;
        this.maxDepth = maxDepth;
    }
    
    /**
     * @param root task to decompose
     * @param snapshot planning state; mutated by the effects of the chosen plan
     * @return status and the primitive task names that ran successfully
     */
    public DecompositionResult decompose(Task root, WorldSnapshot snapshot) {
        List<String> trace = new ArrayList<>();
        TaskStatus status = run(root, snapshot, 0, trace);
        
        if (SearchConfig.isVerbose()) {
            System.err.println("[Decomposer] " + root.getName() + " -> " + status + " " + trace);
        }
        return status == TaskStatus.SUCCESS
                ? DecompositionResult.success(trace)
                : DecompositionResult.failure(trace);
    }
    
    private TaskStatus run(Task task, WorldSnapshot snapshot, int depth, List<String> trace) {
        if (depth > maxDepth) {
            if (SearchConfig.isMinimal()) {
                System.err.println("[Decomposer] Depth limit " + maxDepth + " exceeded at " + task.getName());
            }
            return TaskStatus.FAILURE;
        }
        
        if (task instanceof PrimitiveTask) {
            return runPrimitive((PrimitiveTask) task, snapshot, trace);
        }
        
        CompoundTask compound = (CompoundTask) task;
        return switch (compound.getCombinator()) {
            case SEQUENCE -> runSequence(compound, snapshot, depth, trace);
            case SELECT -> runSelect(compound, snapshot, depth, trace);
        };
    }
    
    private TaskStatus runPrimitive(PrimitiveTask task, WorldSnapshot snapshot, List<String> trace) {
        Condition unmet = task.firstUnmetCondition(snapshot);
        if (unmet != null) {
            logVerbose(task.getName() + ": condition '" + unmet.getName() + "' not met");
            return TaskStatus.FAILURE;
        }
        if (task.runOperator(snapshot) != TaskStatus.SUCCESS) {
            logVerbose(task.getName() + ": operator failed");
            return TaskStatus.FAILURE;
        }
        task.applyEffect(snapshot);
        trace.add(task.getName());
        return TaskStatus.SUCCESS;
    }
    
    private TaskStatus runSequence(CompoundTask sequence, WorldSnapshot snapshot, int depth, List<String> trace) {
        WorldSnapshot.Checkpoint checkpoint = transactional ? snapshot.checkpoint() : null;
        int traceMark = trace.size();
        
        for (Task child : sequence.getChildren()) {
            if (run(child, snapshot, depth + 1, trace) != TaskStatus.SUCCESS) {
                logVerbose(sequence.getName() + ": failed at " + child.getName());
                if (checkpoint != null) {
                    snapshot.restore(checkpoint);
                    trace.subList(traceMark, trace.size()).clear();
                }
                return TaskStatus.FAILURE;
            }
        }
        return TaskStatus.SUCCESS;
    }
    
    private TaskStatus runSelect(CompoundTask select, WorldSnapshot snapshot, int depth, List<String> trace) {
        for (Task child : select.getChildren()) {
            WorldSnapshot.Checkpoint checkpoint = transactional ? snapshot.checkpoint() : null;
            int traceMark = trace.size();
            
            if (run(child, snapshot, depth + 1, trace) == TaskStatus.SUCCESS) {
                return TaskStatus.SUCCESS;
            }
            if (checkpoint != null) {
                snapshot.restore(checkpoint);
                trace.subList(traceMark, trace.size()).clear();
            }
        }
        logVerbose(select.getName() + ": no alternative succeeded");
        return TaskStatus.FAILURE;
    }
    
    private void logVerbose(String msg) {
        if (SearchConfig.isVerbose()) System.err.println("[Decomposer] " + msg);
    }
}
