package io.surfworks.graphlower.core.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Loads and saves {@link LoweringConfig}.
 *
 * <p>Sources, in order of precedence:
 * <ol>
 *   <li>Config file ({@code ~/.config/graphlower/lowering.json})</li>
 *   <li>Defaults</li>
 * </ol>
 */
public final class LoweringConfigLoader {

    private static final Logger LOG = Logger.getLogger(LoweringConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private LoweringConfigLoader() {
    }

    public static LoweringConfig load() {
        return load(LoweringConfig.configFile());
    }

    /**
     * Loads configuration from a specific file; a missing or unreadable file yields defaults.
     */
    public static LoweringConfig load(Path configFile) {
        LoweringConfig config = LoweringConfig.defaults();
        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }
        return config;
    }

    public static void save(LoweringConfig config) throws IOException {
        save(config, LoweringConfig.configFile());
    }

    /**
     * Writes every field of {@code config} to {@code configFile}, creating parent directories.
     */
    public static void save(LoweringConfig config, Path configFile) throws IOException {
        if (configFile.getParent() != null) {
            Files.createDirectories(configFile.getParent());
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("layoutOptimization", config.layoutOptimization());
        root.put("implicitFallbacks", config.implicitFallbacks());
        root.put("alwaysKeepTensorConstants", config.alwaysKeepTensorConstants());
        root.put("disableCppCodegen", config.disableCppCodegen());

        ObjectNode realize = root.putObject("realize");
        realize.put("readsThreshold", config.realizeReadsThreshold());
        realize.put("accReadsThreshold", config.realizeAccReadsThreshold());
        realize.put("opcountThreshold", config.realizeOpcountThreshold());

        ObjectNode layout = root.putObject("layoutOpt");
        layout.put("nodeRatio", config.layoutOptNodeRatio());
        layout.put("smallChannels", config.layoutOptSmallChannels());

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static LoweringConfig loadFromFile(Path configFile, LoweringConfig base) {
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                return base;
            }

            LoweringConfig config = base
                    .withLayoutOptimization(getBooleanOrDefault(root, "layoutOptimization", base.layoutOptimization()))
                    .withImplicitFallbacks(getBooleanOrDefault(root, "implicitFallbacks", base.implicitFallbacks()))
                    .withAlwaysKeepTensorConstants(
                            getBooleanOrDefault(root, "alwaysKeepTensorConstants", base.alwaysKeepTensorConstants()))
                    .withDisableCppCodegen(getBooleanOrDefault(root, "disableCppCodegen", base.disableCppCodegen()));

            if (root.has("realize")) {
                JsonNode realize = root.get("realize");
                config = config.withRealizeThresholds(
                        getIntOrDefault(realize, "readsThreshold", config.realizeReadsThreshold()),
                        getIntOrDefault(realize, "accReadsThreshold", config.realizeAccReadsThreshold()),
                        getIntOrDefault(realize, "opcountThreshold", config.realizeOpcountThreshold()));
            }

            if (root.has("layoutOpt")) {
                JsonNode layout = root.get("layoutOpt");
                config = config.withLayoutOptThresholds(
                        getIntOrDefault(layout, "nodeRatio", config.layoutOptNodeRatio()),
                        getIntOrDefault(layout, "smallChannels", config.layoutOptSmallChannels()));
            }

            return config;

        } catch (IOException | IllegalArgumentException e) {
            LOG.log(Level.FINE, "Ignoring unreadable lowering config " + configFile, e);
            return base;
        }
    }

    private static boolean getBooleanOrDefault(JsonNode node, String field, boolean defaultValue) {
        if (node.has(field)) {
            return node.get(field).asBoolean(defaultValue);
        }
        return defaultValue;
    }

    private static int getIntOrDefault(JsonNode node, String field, int defaultValue) {
        if (node.has(field)) {
            return node.get(field).asInt(defaultValue);
        }
        return defaultValue;
    }
}
