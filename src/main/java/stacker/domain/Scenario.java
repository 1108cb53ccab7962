package stacker.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Describes a block-stacking problem: the grid, where the agent starts, the
 * goal column, the staircase to build and the supply stacks to build it from.
 * 
 * Every field can be overridden on its own; a fresh instance (or
 * {@link #defaults()}) is the canonical scenario: an 8x8 grid, a four-step
 * staircase along x=3 leading to a goal tower of height 5 at (3,6).
 */
public class Scenario {
    
    public static final int DEFAULT_GRID_WIDTH = 8;
    public static final int DEFAULT_GRID_DEPTH = 8;
    
    public static final Cell DEFAULT_START_CELL = Cell.of(3, 1);
    public static final Cell DEFAULT_GOAL_CELL = Cell.of(3, 6);
    public static final int DEFAULT_GOAL_HEIGHT = 5;
    
    public static final List<StepDefinition> DEFAULT_STEPS = List.of(
            StepDefinition.of(3, 2, 1, "Step 1"),
            StepDefinition.of(3, 3, 2, "Step 2"),
            StepDefinition.of(3, 4, 3, "Step 3"),
            StepDefinition.of(3, 5, 4, "Step 4"));
    
    public static final List<SupplySource> DEFAULT_SUPPLIES = List.of(
            SupplySource.of(1, 1, 3),
            SupplySource.of(5, 2, 2),
            SupplySource.of(6, 4, 2),
            SupplySource.of(2, 6, 2),
            SupplySource.of(4, 4, 3));
    
    private String name = "default";
    private int gridWidth = DEFAULT_GRID_WIDTH;
    private int gridDepth = DEFAULT_GRID_DEPTH;
    private Cell startCell = DEFAULT_START_CELL;
    private Cell goalCell = DEFAULT_GOAL_CELL;
    private int goalHeight = DEFAULT_GOAL_HEIGHT;
    private List<StepDefinition> steps = DEFAULT_STEPS;
    private List<SupplySource> supplies = DEFAULT_SUPPLIES;
    private Map<Cell, Integer> initialHeights = Collections.emptyMap();
    private boolean startCarrying = false;
    private int maxIterations = 0;
    
    public Scenario() {}
    
    /**
     * Creates a Scenario with default values.
     */
    public static Scenario defaults() {
        return new Scenario();
    }
    
    /**
     * Builds the starting height grid. Order matters: the goal column is
     * raised first, then supply stacks, then explicit initial heights, so a
     * later entry overrides an earlier one on the same cell.
     * 
     * @return a fresh grid
     * @throws IllegalArgumentException if any configured cell is outside the grid
     */
    public HeightGrid createInitialGrid() {
        HeightGrid grid = new HeightGrid(gridWidth, gridDepth);
        requireInBounds(grid, startCell, "start cell");
        requireInBounds(grid, goalCell, "goal cell");
        for (StepDefinition step : steps) {
            requireInBounds(grid, step.cell, step.label);
        }
        grid.set(goalCell, goalHeight);
        for (SupplySource source : supplies) {
            requireInBounds(grid, source.cell, "supply");
            grid.set(source.cell, source.height);
        }
        for (Map.Entry<Cell, Integer> entry : initialHeights.entrySet()) {
            requireInBounds(grid, entry.getKey(), "initial height");
            grid.set(entry.getKey(), entry.getValue());
        }
        return grid;
    }
    
    private static void requireInBounds(HeightGrid grid, Cell cell, String what) {
        if (!grid.inBounds(cell)) {
            throw new IllegalArgumentException("The " + what + " " + cell + " lies outside the "
                    + grid.getWidth() + "x" + grid.getDepth() + " grid");
        }
    }
    
    public String getName() { return name; }
    public Scenario setName(String name) { this.name = Objects.requireNonNull(name); return this; }
    
    public int getGridWidth() { return gridWidth; }
    public int getGridDepth() { return gridDepth; }
    public Scenario setGridSize(int width, int depth) {
        this.gridWidth = width;
        this.gridDepth = depth;
        return this;
    }
    
    public Cell getStartCell() { return startCell; }
    public Scenario setStartCell(Cell startCell) { this.startCell = Objects.requireNonNull(startCell); return this; }
    
    public Cell getGoalCell() { return goalCell; }
    public Scenario setGoalCell(Cell goalCell) { this.goalCell = Objects.requireNonNull(goalCell); return this; }
    
    public int getGoalHeight() { return goalHeight; }
    public Scenario setGoalHeight(int goalHeight) { this.goalHeight = goalHeight; return this; }
    
    public List<StepDefinition> getSteps() { return steps; }
    public Scenario setSteps(List<StepDefinition> steps) { this.steps = List.copyOf(steps); return this; }
    
    public List<SupplySource> getSupplies() { return supplies; }
    public Scenario setSupplies(List<SupplySource> supplies) { this.supplies = List.copyOf(supplies); return this; }
    
    /** @return unmodifiable view, in insertion order */
    public Map<Cell, Integer> getInitialHeights() { return initialHeights; }
    public Scenario setInitialHeights(Map<Cell, Integer> initialHeights) {
        this.initialHeights = Collections.unmodifiableMap(new LinkedHashMap<>(initialHeights));
        return this;
    }
    
    public boolean isStartCarrying() { return startCarrying; }
    public Scenario setStartCarrying(boolean startCarrying) { this.startCarrying = startCarrying; return this; }
    
    /** @return iteration budget suggested by the scenario, 0 when none */
    public int getMaxIterations() { return maxIterations; }
    public Scenario setMaxIterations(int maxIterations) { this.maxIterations = Math.max(0, maxIterations); return this; }
    
    @Override
    public String toString() {
        return "Scenario[" + name + ", start=" + startCell + ", goal=" + goalCell + "@" + goalHeight
                + ", steps=" + steps.size() + ", supplies=" + supplies.size() + "]";
    }
}
