package stacker.client;

import org.junit.jupiter.api.Test;
import stacker.planning.HeadlessRunResult;
import stacker.planning.SearchConfig;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlockStackerClientTest {
    
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream debug = new ByteArrayOutputStream();
    
    private BlockStackerClient client(String input, SearchConfig config) {
        return new BlockStackerClient(new BufferedReader(new StringReader(input)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(debug, true, StandardCharsets.UTF_8), config);
    }
    
    @Test
    void runsCatalogScenarioAndPrintsActions() throws IOException {
        HeadlessRunResult result = client("", SearchConfig.defaults()).run("simpleNavigate");
        
        String printed = out.toString(StandardCharsets.UTF_8);
        assertTrue(result.reachedGoal);
        assertTrue(printed.startsWith("1. "), printed);
        assertTrue(printed.contains("Outcome: GOAL_REACHED after 2 iterations"), printed);
        assertTrue(debug.toString(StandardCharsets.UTF_8).contains("Goal reached!"));
    }
    
    @Test
    void readsScenarioFromInputStream() throws IOException {
        String scenario = "#name\nstdin\n#start\n3 1\n#goal\n3 2 1\n#steps\n#supplies\n#end\n";
        
        HeadlessRunResult result = client(scenario, SearchConfig.defaults()).run("-");
        
        assertTrue(result.reachedGoal);
        assertEquals(1, result.actions.size());
    }
    
    @Test
    void unknownSourceIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> client("", SearchConfig.defaults()).run("no-such-scenario"));
    }
    
    @Test
    void environmentTogglesRunnerOptions() {
        PrintStream sink = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
        
        SearchConfig config = BlockStackerClient.configFromEnvironment(
                Map.of("STACKER_LOOKAHEAD", "TRUE", "STACKER_MAX_ITERATIONS", " 12 "), sink);
        SearchConfig untouched = BlockStackerClient.configFromEnvironment(Map.of(), sink);
        
        assertTrue(config.isLookahead());
        assertEquals(12, config.getMaxIterations());
        assertFalse(untouched.isLookahead());
        assertEquals(0, untouched.getMaxIterations());
    }
    
    @Test
    void badIterationOverrideIsRejected() {
        PrintStream sink = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
        
        assertThrows(IllegalArgumentException.class,
                () -> BlockStackerClient.configFromEnvironment(Map.of("STACKER_MAX_ITERATIONS", "lots"), sink));
    }
}
