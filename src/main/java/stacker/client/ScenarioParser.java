package stacker.client;

import stacker.domain.Cell;
import stacker.domain.Scenario;
import stacker.domain.StepDefinition;
import stacker.domain.SupplySource;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.*;

/**
 * Parses scenarios from a sectioned text format.
 * 
 * Scenario format:
 * <pre>
 * #name
 * Staircase
 * #size
 * 8 8
 * #start
 * 3 1
 * #goal
 * 3 6 5
 * #steps
 * 3 2 1 Step 1
 * 3 3 2 Step 2
 * #supplies
 * 1 1 3
 * 5 2 2
 * #heights
 * 2 2 1
 * #carrying
 * true
 * #iterations
 * 50
 * #end
 * </pre>
 * 
 * Steps are "x z targetHeight label", supplies and heights are "x z height".
 * Any section may be left out; the canonical scenario's value is used then.
 * A present #steps or #supplies section replaces the default list, even when
 * it is empty. Blank lines are ignored.
 */
public class ScenarioParser {
    
    /**
     * Parses a scenario from a BufferedReader.
     * Reads until #end marker or end of stream.
     * 
     * @param reader the reader to read from
     * @return the parsed scenario
     * @throws IOException if reading fails
     * @throws IllegalArgumentException if the format is invalid
     */
    public Scenario parse(BufferedReader reader) throws IOException {
        Scenario scenario = new Scenario();
        List<StepDefinition> steps = null;
        List<SupplySource> supplies = null;
        Map<Cell, Integer> heights = new LinkedHashMap<>();
        
        String line;
        String currentSection = null;
        int lineNumber = 0;
        
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            
            // Check for section headers
            if (line.startsWith("#")) {
                currentSection = line.substring(1).trim().toLowerCase(Locale.ROOT);
                if (currentSection.equals("end")) {
                    break;
                }
                switch (currentSection) {
                    case "steps":
                        steps = new ArrayList<>();
                        break;
                    case "supplies":
                        supplies = new ArrayList<>();
                        break;
                    case "name":
                    case "size":
                    case "start":
                    case "goal":
                    case "heights":
                    case "carrying":
                    case "iterations":
                        break;
                    default:
                        throw new IllegalArgumentException("Line " + lineNumber + ": unknown section #" + currentSection);
                }
                continue;
            }
            
            if (currentSection == null || line.isBlank()) {
                continue;
            }
            
            try {
                switch (currentSection) {
                    case "name":
                        scenario.setName(line.trim());
                        break;
                        
                    case "size": {
                        int[] v = parseInts(line, 2);
                        scenario.setGridSize(v[0], v[1]);
                        break;
                    }
                    
                    case "start": {
                        int[] v = parseInts(line, 2);
                        scenario.setStartCell(Cell.of(v[0], v[1]));
                        break;
                    }
                    
                    case "goal": {
                        int[] v = parseInts(line, 3);
                        scenario.setGoalCell(Cell.of(v[0], v[1]));
                        scenario.setGoalHeight(requireNonNegative(v[2]));
                        break;
                    }
                    
                    case "steps":
                        steps.add(parseStep(line));
                        break;
                        
                    case "supplies": {
                        int[] v = parseInts(line, 3);
                        supplies.add(SupplySource.of(v[0], v[1], requireNonNegative(v[2])));
                        break;
                    }
                    
                    case "heights": {
                        int[] v = parseInts(line, 3);
                        heights.put(Cell.of(v[0], v[1]), requireNonNegative(v[2]));
                        break;
                    }
                    
                    case "carrying":
                        scenario.setStartCarrying(parseBoolean(line.trim()));
                        break;
                        
                    case "iterations":
                        scenario.setMaxIterations(parseInts(line, 1)[0]);
                        break;
                }
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Line " + lineNumber + " (#" + currentSection + "): "
                        + e.getMessage(), e);
            }
        }
        
        if (steps != null) scenario.setSteps(steps);
        if (supplies != null) scenario.setSupplies(supplies);
        if (!heights.isEmpty()) scenario.setInitialHeights(heights);
        
        // Fail on bad cells here rather than when the run starts
        scenario.createInitialGrid();
        return scenario;
    }
    
    private static StepDefinition parseStep(String line) {
        String[] parts = line.trim().split("\\s+", 4);
        if (parts.length < 4) {
            throw new IllegalArgumentException("Expected 'x z targetHeight label', got: " + line);
        }
        int x = parseInt(parts[0]);
        int z = parseInt(parts[1]);
        int target = requireNonNegative(parseInt(parts[2]));
        return StepDefinition.of(x, z, target, parts[3].trim());
    }
    
    private static int[] parseInts(String line, int count) {
        String[] parts = line.trim().split("\\s+");
        if (parts.length != count) {
            throw new IllegalArgumentException("Expected " + count + " integers, got: " + line);
        }
        int[] values = new int[count];
        for (int i = 0; i < count; i++) {
            values[i] = parseInt(parts[i]);
        }
        return values;
    }
    
    private static int parseInt(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: " + token, e);
        }
    }
    
    private static int requireNonNegative(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Height cannot be negative: " + value);
        }
        return value;
    }
    
    private static boolean parseBoolean(String token) {
        if (token.equalsIgnoreCase("true")) return true;
        if (token.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException("Expected true or false, got: " + token);
    }
}
