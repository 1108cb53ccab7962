package stacker.client;

import stacker.domain.PlannedAction;
import stacker.domain.Scenario;
import stacker.planning.HeadlessRunResult;
import stacker.planning.HeadlessRunner;
import stacker.planning.SearchConfig;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Command-line entry point: runs one scenario headlessly and prints the
 * executed actions.
 * 
 * Usage: {@code BlockStackerClient [scenario-id | file | -]}
 * - scenario-id: a {@link ScenarioCatalog} id (default: "default")
 * - file: a scenario in {@link ScenarioParser} format
 * - "-": a scenario in that format read from stdin
 * 
 * Actions and the final grid go to stdout; progress and diagnostics go to
 * stderr.
 * 
 * Environment Variables:
 * - STACKER_LOOKAHEAD=true : try to plan the whole staircase in one pass
 * - STACKER_MAX_ITERATIONS=n : override the iteration budget
 */
public class BlockStackerClient {
    
    /** Exit status when the run ends without reaching the goal */
    public static final int EXIT_GOAL_NOT_REACHED = 2;
    
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream debugOut;
    private final SearchConfig config;
    
    /**
     * Creates a client on the standard streams, configured from the environment.
     */
    public BlockStackerClient() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out, System.err, configFromEnvironment(System.getenv(), System.err));
    }
    
    /**
     * Creates a client with custom streams and config (for testing).
     */
    public BlockStackerClient(BufferedReader in, PrintStream out, PrintStream debug, SearchConfig config) {
        this.in = in;
        this.out = out;
        this.debugOut = debug;
        this.config = config;
    }
    
    public static void main(String[] args) {
        BlockStackerClient client = new BlockStackerClient();
        try {
            HeadlessRunResult result = client.run(args.length > 0 ? args[0] : "default");
            if (!result.reachedGoal) {
                System.exit(EXIT_GOAL_NOT_REACHED);
            }
        } catch (Exception e) {
            System.err.println("Client error: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
    
    /**
     * Loads the scenario, runs it, and prints the outcome.
     * 
     * @param source catalog id, scenario file path, or "-" for the input stream
     * @return the run result
     * @throws IOException if the scenario cannot be read
     * @throws IllegalArgumentException if the scenario is unknown or malformed
     */
    public HeadlessRunResult run(String source) throws IOException {
        Scenario scenario = loadScenario(source);
        
        debugOut.println("Scenario: " + scenario);
        debugOut.println("Initial heights:");
        debugOut.println(scenario.createInitialGrid().toGridString());
        
        HeadlessRunner runner = new HeadlessRunner(config);
        HeadlessRunResult result = runner.run(scenario);
        
        int index = 1;
        for (PlannedAction action : result.actions) {
            out.println(index++ + ". " + action);
        }
        out.println("Outcome: " + result.outcome + " after " + result.iterations + " iterations");
        out.println(result.finalGrid.toGridString());
        
        if (result.reachedGoal) {
            debugOut.println("Goal reached!");
        } else {
            debugOut.println("Goal not reached: " + result.outcome);
        }
        return result;
    }
    
    private Scenario loadScenario(String source) throws IOException {
        ScenarioParser parser = new ScenarioParser();
        if ("-".equals(source)) {
            return parser.parse(in);
        }
        if (ScenarioCatalog.contains(source)) {
            return ScenarioCatalog.get(source);
        }
        Path path = Path.of(source);
        if (Files.isRegularFile(path)) {
            try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                return parser.parse(reader);
            }
        }
        // Neither a file nor a known id: report the catalog
        return ScenarioCatalog.get(source);
    }
    
    /**
     * Reads runner options from environment variables.
     * 
     * @param env the environment, e.g. {@code System.getenv()}
     * @param debug where to report the options that were picked up
     * @throws IllegalArgumentException if STACKER_MAX_ITERATIONS is not a number
     */
    public static SearchConfig configFromEnvironment(Map<String, String> env, PrintStream debug) {
        SearchConfig config = SearchConfig.defaults();
        
        if ("true".equalsIgnoreCase(env.get("STACKER_LOOKAHEAD"))) {
            config.setLookahead(true);
            debug.println("[Client] STACKER_LOOKAHEAD enabled via environment variable");
        }
        
        String maxIterations = env.get("STACKER_MAX_ITERATIONS");
        if (maxIterations != null && !maxIterations.isBlank()) {
            try {
                config.setMaxIterations(Integer.parseInt(maxIterations.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("STACKER_MAX_ITERATIONS is not a number: " + maxIterations, e);
            }
            debug.println("[Client] STACKER_MAX_ITERATIONS=" + config.getMaxIterations() + " via environment variable");
        }
        return config;
    }
}
