package stacker.planning;

import stacker.domain.HeightGrid;
import stacker.domain.Scenario;
import stacker.planning.pathfinding.Footprint;

/**
 * Configuration for the planner and the replanning loop.
 * Centralizes all configurable parameters to avoid hardcoding.
 */
public class SearchConfig {
    
    /** Iteration budget every run gets, regardless of staircase size */
    public static final int ITERATION_LIMIT_BASE = 16;
    
    /** Additional iterations granted per staircase step */
    public static final int ITERATION_LIMIT_PER_STEP = 8;
    
    /** Maximum node expansions for a single path query */
    public static final int DEFAULT_MAX_PATH_EXPANSIONS = 10_000;
    
    /** Deepest task nesting the decomposer follows before giving up */
    public static final int MAX_DECOMPOSITION_DEPTH = 64;
    
    /** Horizontal distance from the goal top that still counts as arrived */
    public static final double GOAL_HORIZONTAL_TOLERANCE = HeightGrid.BLOCK_SIZE * 0.25;
    
    /** Vertical distance from the goal top that still counts as arrived */
    public static final double GOAL_VERTICAL_TOLERANCE = HeightGrid.BLOCK_SIZE * 0.25;
    
    /** Two positions closer than this are the same spot (no walk needed) */
    public static final double SAME_POSITION_EPSILON = 1e-3;

    // ========== Logging Configuration ==========
    
    /**
     * Log level for controlling output verbosity.
     * 0 = SILENT (no output except critical errors)
     * 1 = MINIMAL (only run outcome)
     * 2 = NORMAL (+ iteration progress, warnings)
     * 3 = VERBOSE (+ selector and decomposition detail)
     * Read once from the system property {@code stacker.logLevel}.
     */
    public static final int LOG_LEVEL = Integer.getInteger("stacker.logLevel", 1);
    
    /** Helper method to check if verbose logging is enabled */
    public static boolean isVerbose() { return LOG_LEVEL >= 3; }
    
    /** Helper method to check if normal logging is enabled */
    public static boolean isNormal() { return LOG_LEVEL >= 2; }
    
    /** Helper method to check if minimal logging is enabled */
    public static boolean isMinimal() { return LOG_LEVEL >= 1; }
    
    // Instance configuration
    private int maxIterations = 0;
    private int maxPathExpansions = DEFAULT_MAX_PATH_EXPANSIONS;
    private boolean transactionalSequences = true;
    private boolean lookahead = false;
    private Footprint footprint = Footprint.AGENT;
    
    public SearchConfig() {}
    
    /**
     * Creates a SearchConfig with default values.
     * Factory method for cleaner API.
     */
    public static SearchConfig defaults() {
        return new SearchConfig();
    }
    
    /**
     * Iteration budget for a staircase of the given size:
     * {@code max(BASE, BASE + steps * PER_STEP)}.
     */
    public static int iterationLimitFor(int stepCount) {
        return Math.max(ITERATION_LIMIT_BASE, ITERATION_LIMIT_BASE + stepCount * ITERATION_LIMIT_PER_STEP);
    }
    
    /**
     * Budget for a run of the scenario: this config's explicit budget, else
     * the scenario's own, else the step-scaled default.
     */
    public int resolveMaxIterations(Scenario scenario) {
        if (maxIterations > 0) return maxIterations;
        if (scenario.getMaxIterations() > 0) return scenario.getMaxIterations();
        return iterationLimitFor(scenario.getSteps().size());
    }
    
    /** @return explicit iteration budget, 0 when derived from the staircase */
    public int getMaxIterations() { return maxIterations; }
    public void setMaxIterations(int maxIterations) { this.maxIterations = Math.max(0, maxIterations); }
    
    public int getMaxPathExpansions() { return maxPathExpansions; }
    public void setMaxPathExpansions(int maxPathExpansions) { this.maxPathExpansions = maxPathExpansions; }
    
    /** When true, a failing Sequence undoes the effects of its earlier children. */
    public boolean isTransactionalSequences() { return transactionalSequences; }
    public void setTransactionalSequences(boolean transactionalSequences) { this.transactionalSequences = transactionalSequences; }
    
    /** When true, the domain first tries to plan the whole staircase in one pass. */
    public boolean isLookahead() { return lookahead; }
    public void setLookahead(boolean lookahead) { this.lookahead = lookahead; }
    
    public Footprint getFootprint() { return footprint; }
    public void setFootprint(Footprint footprint) { this.footprint = footprint; }
}
