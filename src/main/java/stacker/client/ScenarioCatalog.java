package stacker.client;

import stacker.domain.Cell;
import stacker.domain.Scenario;
import stacker.domain.StepDefinition;
import stacker.domain.SupplySource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Named scenarios, from the full staircase down to single-behaviour checks.
 * Each lookup returns a fresh, independently modifiable {@link Scenario}.
 */
public final class ScenarioCatalog {
    
    private static final Map<String, Supplier<Scenario>> SCENARIOS = new LinkedHashMap<>();
    
    static {
        SCENARIOS.put("default", Scenario::defaults);
        
        SCENARIOS.put("atGoal", () -> new Scenario()
                .setName("atGoal")
                .setStartCell(Cell.of(3, 3))
                .setGoalCell(Cell.of(3, 3))
                .setGoalHeight(1)
                .setSteps(List.of())
                .setSupplies(List.of()));
        
        SCENARIOS.put("simpleNavigate", () -> new Scenario()
                .setName("simpleNavigate")
                .setStartCell(Cell.of(1, 1))
                .setGoalCell(Cell.of(3, 3))
                .setGoalHeight(1)
                .setSteps(List.of())
                .setSupplies(List.of()));
        
        SCENARIOS.put("walkStep", () -> new Scenario()
                .setName("walkStep")
                .setStartCell(Cell.of(3, 1))
                .setGoalCell(Cell.of(3, 2))
                .setGoalHeight(1)
                .setSteps(List.of())
                .setSupplies(List.of())
                .setInitialHeights(Map.of(Cell.of(3, 2), 1))
                .setMaxIterations(10));
        
        SCENARIOS.put("pickPlaceOne", () -> new Scenario()
                .setName("pickPlaceOne")
                .setStartCell(Cell.of(0, 0))
                .setGoalCell(Cell.of(2, 2))
                .setGoalHeight(2)
                .setSteps(List.of(StepDefinition.of(2, 1, 1, "Step to goal")))
                .setSupplies(List.of(SupplySource.of(0, 1, 1)))
                .setMaxIterations(20));
        
        SCENARIOS.put("walkExistingStairs", () -> twoStepStaircase("walkExistingStairs")
                .setSupplies(List.of())
                .setInitialHeights(orderedHeights(Cell.of(3, 2), 1, Cell.of(3, 3), 2))
                .setMaxIterations(20));
        
        SCENARIOS.put("buildTwoSteps", () -> twoStepStaircase("buildTwoSteps")
                .setSupplies(List.of(SupplySource.of(1, 1, 2), SupplySource.of(5, 2, 2)))
                .setMaxIterations(200));
        
        SCENARIOS.put("directPlaceAdjacent", () -> new Scenario()
                .setName("directPlaceAdjacent")
                .setStartCell(Cell.of(2, 2))
                .setGoalCell(Cell.of(3, 3))
                .setGoalHeight(2)
                .setSteps(List.of(StepDefinition.of(3, 2, 1, "Step to goal")))
                .setSupplies(List.of(SupplySource.of(2, 2, 2)))
                .setInitialHeights(Map.of(Cell.of(2, 2), 1))
                .setMaxIterations(50));
    }
    
    private ScenarioCatalog() {}
    
    /**
     * @param id scenario id, e.g. "default" or "pickPlaceOne"
     * @return a fresh copy of the scenario
     * @throws IllegalArgumentException if no scenario has that id
     */
    public static Scenario get(String id) {
        Supplier<Scenario> factory = SCENARIOS.get(id);
        if (factory == null) {
            throw new IllegalArgumentException("Scenario not found: " + id + " (known: " + ids() + ")");
        }
        return factory.get();
    }
    
    public static boolean contains(String id) {
        return SCENARIOS.containsKey(id);
    }
    
    /** @return ids in catalog order */
    public static Set<String> ids() {
        return Collections.unmodifiableSet(SCENARIOS.keySet());
    }
    
    private static Scenario twoStepStaircase(String name) {
        return new Scenario()
                .setName(name)
                .setStartCell(Cell.of(3, 1))
                .setGoalCell(Cell.of(3, 3))
                .setGoalHeight(0)
                .setSteps(List.of(
                        StepDefinition.of(3, 2, 1, "Step 1"),
                        StepDefinition.of(3, 3, 2, "Goal column")));
    }
    
    private static Map<Cell, Integer> orderedHeights(Cell a, int heightA, Cell b, int heightB) {
        Map<Cell, Integer> heights = new LinkedHashMap<>();
        heights.put(a, heightA);
        heights.put(b, heightB);
        return heights;
    }
}
