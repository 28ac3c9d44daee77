package io.surfworks.foldforge.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and saves RewriteConfig.
 *
 * <p>Configuration sources (in order of precedence):
 * <ol>
 *   <li>Config file ({@code ~/.config/foldforge/rewrite.json})</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <p>Example file:
 * <pre>{@code
 * {
 *   "maxIterations": 20,
 *   "enableBubbleUpExpand": false,
 *   "disabledPatterns": ["fold-unpadding-collapse"]
 * }
 * }</pre>
 */
public final class RewriteConfigLoader {

    private static final Logger LOG = Logger.getLogger(RewriteConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private RewriteConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     *
     * <p>If the config file doesn't exist, returns defaults.
     *
     * @return the loaded configuration
     */
    public static RewriteConfig load() {
        return load(RewriteConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     */
    public static RewriteConfig load(Path configFile) {
        RewriteConfig config = RewriteConfig.defaults();
        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }
        return config;
    }

    /**
     * Parses configuration from a JSON document, falling back to defaults for absent keys.
     *
     * @param json the JSON text
     * @return the parsed configuration
     * @throws IOException if the text is not valid JSON
     */
    public static RewriteConfig parse(String json) throws IOException {
        return fromJson(JSON.readTree(json), RewriteConfig.defaults());
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(RewriteConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("maxIterations", config.maxIterations());
        root.put("removeDeadOps", config.removeDeadOps());
        root.put("enableBubbleUpExpand", config.enableBubbleUpExpand());
        root.put("recordDiagnostics", config.recordDiagnostics());
        root.put("verifyAfterEachSweep", config.verifyAfterEachSweep());

        ArrayNode disabled = root.putArray("disabledPatterns");
        new TreeSet<>(config.disabledPatterns()).forEach(disabled::add);

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static RewriteConfig loadFromFile(Path configFile, RewriteConfig base) {
        try {
            return fromJson(JSON.readTree(configFile.toFile()), base);
        } catch (IOException | IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Ignoring unreadable rewrite config " + configFile, e);
            return base;
        }
    }

    private static RewriteConfig fromJson(JsonNode root, RewriteConfig base) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("rewrite config must be a JSON object");
        }

        Set<String> disabled = new HashSet<>(base.disabledPatterns());
        if (root.has("disabledPatterns")) {
            disabled.clear();
            for (JsonNode name : root.get("disabledPatterns")) {
                disabled.add(name.asText());
            }
        }

        return new RewriteConfig(
                getIntOrDefault(root, "maxIterations", base.maxIterations()),
                getBooleanOrDefault(root, "removeDeadOps", base.removeDeadOps()),
                getBooleanOrDefault(root, "enableBubbleUpExpand", base.enableBubbleUpExpand()),
                getBooleanOrDefault(root, "recordDiagnostics", base.recordDiagnostics()),
                getBooleanOrDefault(root, "verifyAfterEachSweep", base.verifyAfterEachSweep()),
                disabled
        );
    }

    private static int getIntOrDefault(JsonNode node, String field, int defaultValue) {
        if (node.has(field)) {
            return node.get(field).asInt(defaultValue);
        }
        return defaultValue;
    }

    private static boolean getBooleanOrDefault(JsonNode node, String field, boolean defaultValue) {
        if (node.has(field)) {
            return node.get(field).asBoolean(defaultValue);
        }
        return defaultValue;
    }
}
