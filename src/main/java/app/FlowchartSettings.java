package app;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import synthesis.FlowLabels;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Conversion and layout settings. Defaults come from the classpath resource
 * {@value #RESOURCE}; a user file only needs to name the keys it changes.
 */
public class FlowchartSettings {
    private static final Logger logger = LoggerFactory.getLogger(FlowchartSettings.class);

    public static final String RESOURCE = "/flowchart-settings.json";

    private static final Gson GSON = new Gson();

    // Field names are the JSON keys.
    private double originX = -4600;
    private double originY = -4800;
    private double rowSpacing = 125;
    private double columnSpacing = 200;
    private double functionOffsetX = 250;
    private String startLabel = "Start";
    private String endLabel = "End";
    private String trueLabel = "yes";
    private String falseLabel = "no";
    private String defaultLabel = "default";
    private boolean collapseInputLoops = false;
    private int collapseThreshold = 3;
    private int parallelism = 4;
    private boolean verifyInvariants = true;

    /**
     * Loads the bundled defaults. Falls back to the built-in values when the
     * resource is missing or unreadable.
     */
    public static FlowchartSettings load() {
        try (InputStream in = FlowchartSettings.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.warn("Settings resource {} not found, using built-in defaults", RESOURCE);
                return new FlowchartSettings();
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                FlowchartSettings settings = GSON.fromJson(reader, FlowchartSettings.class);
                return settings == null ? new FlowchartSettings() : settings;
            }
        } catch (IOException | JsonParseException e) {
            logger.error("Error loading settings from {}: {}", RESOURCE, e.getMessage());
            return new FlowchartSettings();
        }
    }

    /**
     * Loads the bundled defaults and applies the keys present in {@code overrides}.
     */
    public static FlowchartSettings load(Path overrides) throws IOException {
        FlowchartSettings base = load();
        try (Reader reader = Files.newBufferedReader(overrides, StandardCharsets.UTF_8)) {
            JsonObject merged = GSON.toJsonTree(base).getAsJsonObject();
            JsonObject user = JsonParser.parseReader(reader).getAsJsonObject();
            user.entrySet().forEach(entry -> merged.add(entry.getKey(), entry.getValue()));
            FlowchartSettings settings = GSON.fromJson(merged, FlowchartSettings.class);
            logger.info("Loaded settings overrides from {}", overrides);
            return settings;
        } catch (JsonParseException | IllegalStateException e) {
            throw new IOException("Invalid settings file " + overrides + ": " + e.getMessage(), e);
        }
    }

    public FlowLabels toLabels() {
        return new FlowLabels(startLabel, endLabel, trueLabel, falseLabel, defaultLabel);
    }

    public double getOriginX() { return originX; }
    public double getOriginY() { return originY; }
    public double getRowSpacing() { return rowSpacing; }
    public double getColumnSpacing() { return columnSpacing; }
    public double getFunctionOffsetX() { return functionOffsetX; }
    public boolean isCollapseInputLoops() { return collapseInputLoops; }
    public int getCollapseThreshold() { return collapseThreshold; }
    public int getParallelism() { return Math.max(1, parallelism); }
    public boolean isVerifyInvariants() { return verifyInvariants; }

    public FlowchartSettings setCollapseInputLoops(boolean collapseInputLoops) {
        this.collapseInputLoops = collapseInputLoops;
        return this;
    }

    public FlowchartSettings setParallelism(int parallelism) {
        this.parallelism = parallelism;
        return this;
    }
}
