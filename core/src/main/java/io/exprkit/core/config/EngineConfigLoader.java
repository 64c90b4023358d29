package io.exprkit.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.exprkit.core.engine.ExpressionOption;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link EngineConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * engine:
 *   options: [bool-symbols]
 *   cache-enabled: true
 * parser:
 *   max-nesting-depth: 256
 *   max-tree-depth: 1024
 *   max-source-length: 16384
 * constants:
 *   e: 2.718281828
 * arrays:
 *   a: [10, 20, 30]
 * </pre>
 *
 * <p>
 * Missing keys keep the {@link EngineConfig.Builder} defaults. Environment variables take
 * precedence over YAML values; a variable is "set" only if it is defined and non-blank after
 * trimming:
 * <ul>
 * <li>{@code EXPRKIT_OPTIONS} (comma-separated option names, replaces {@code engine.options})</li>
 * <li>{@code EXPRKIT_CACHE_ENABLED}</li>
 * <li>{@code EXPRKIT_MAX_NESTING_DEPTH}</li>
 * <li>{@code EXPRKIT_MAX_TREE_DEPTH}</li>
 * <li>{@code EXPRKIT_MAX_SOURCE_LENGTH}</li>
 * </ul>
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_OPTIONS = "EXPRKIT_OPTIONS";
    static final String ENV_CACHE_ENABLED = "EXPRKIT_CACHE_ENABLED";
    static final String ENV_MAX_NESTING_DEPTH = "EXPRKIT_MAX_NESTING_DEPTH";
    static final String ENV_MAX_TREE_DEPTH = "EXPRKIT_MAX_TREE_DEPTH";
    static final String ENV_MAX_SOURCE_LENGTH = "EXPRKIT_MAX_SOURCE_LENGTH";

    private EngineConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws EngineConfigException if the file is missing, malformed or invalid
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@code envLookup}.
     * The lookup returns {@code null} for undefined variables.
     *
     * @throws EngineConfigException if the file is missing, malformed or invalid
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new EngineConfigException("Configuration file not found: " + configPath);
        }
        EngineConfig config;
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            config = mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (EngineConfigException e) {
            throw e;
        } catch (IOException e) {
            throw new EngineConfigException("Failed to parse YAML configuration: " + configPath, e);
        } catch (IllegalArgumentException e) {
            throw new EngineConfigException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
        LOG.info(
                "Loaded engine configuration from {} (options={}, constants={}, arrays={}, cacheEnabled={})",
                configPath,
                config.options(),
                config.constants().size(),
                config.arrays().size(),
                config.cacheEnabled());
        return config;
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EngineConfig.Builder builder = EngineConfig.builder();

        // --- YAML mapping ---

        JsonNode engine = root.path("engine");
        if (engine.has("options")) {
            builder.options(parseOptions(engine.get("options")));
        }
        if (engine.has("cache-enabled")) {
            builder.cacheEnabled(engine.get("cache-enabled").asBoolean());
        }

        JsonNode parser = root.path("parser");
        if (parser.has("max-nesting-depth")) {
            builder.maxNestingDepth(requireInt(parser.get("max-nesting-depth"), "parser.max-nesting-depth"));
        }
        if (parser.has("max-tree-depth")) {
            builder.maxTreeDepth(requireInt(parser.get("max-tree-depth"), "parser.max-tree-depth"));
        }
        if (parser.has("max-source-length")) {
            builder.maxSourceLength(requireInt(parser.get("max-source-length"), "parser.max-source-length"));
        }

        Iterator<Map.Entry<String, JsonNode>> constants = root.path("constants").fields();
        while (constants.hasNext()) {
            Map.Entry<String, JsonNode> entry = constants.next();
            builder.constant(entry.getKey(), requireNumber(entry.getValue(), "constants." + entry.getKey()));
        }

        Iterator<Map.Entry<String, JsonNode>> arrays = root.path("arrays").fields();
        while (arrays.hasNext()) {
            Map.Entry<String, JsonNode> entry = arrays.next();
            String field = "arrays." + entry.getKey();
            if (!entry.getValue().isArray()) {
                throw new EngineConfigException("'" + field + "' must be a list of numbers");
            }
            List<Double> values = new ArrayList<>();
            for (JsonNode value : entry.getValue()) {
                values.add(requireNumber(value, field));
            }
            builder.array(entry.getKey(), values);
        }

        // --- Environment variable overlay ---

        if (isSet(envLookup, ENV_OPTIONS)) {
            Set<ExpressionOption> options = EnumSet.noneOf(ExpressionOption.class);
            for (String name : envLookup.apply(ENV_OPTIONS).split(",")) {
                if (!name.isBlank()) {
                    options.add(ExpressionOption.fromConfigName(name));
                }
            }
            builder.options(options);
        }
        if (isSet(envLookup, ENV_CACHE_ENABLED)) {
            builder.cacheEnabled(Boolean.parseBoolean(envLookup.apply(ENV_CACHE_ENABLED).trim()));
        }
        if (isSet(envLookup, ENV_MAX_NESTING_DEPTH)) {
            builder.maxNestingDepth(Integer.parseInt(envLookup.apply(ENV_MAX_NESTING_DEPTH).trim()));
        }
        if (isSet(envLookup, ENV_MAX_TREE_DEPTH)) {
            builder.maxTreeDepth(Integer.parseInt(envLookup.apply(ENV_MAX_TREE_DEPTH).trim()));
        }
        if (isSet(envLookup, ENV_MAX_SOURCE_LENGTH)) {
            builder.maxSourceLength(Integer.parseInt(envLookup.apply(ENV_MAX_SOURCE_LENGTH).trim()));
        }
        return builder.build();
    }

    private static Set<ExpressionOption> parseOptions(JsonNode node) {
        if (!node.isArray()) {
            throw new EngineConfigException("'engine.options' must be a list of option names");
        }
        Set<ExpressionOption> options = EnumSet.noneOf(ExpressionOption.class);
        for (JsonNode name : node) {
            options.add(ExpressionOption.fromConfigName(name.asText()));
        }
        return options;
    }

    // --- YAML helpers ---

    private static double requireNumber(JsonNode node, String field) {
        if (!node.isNumber()) {
            throw new EngineConfigException("'" + field + "' must be a number, got: " + node);
        }
        return node.asDouble();
    }

    private static int requireInt(JsonNode node, String field) {
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new EngineConfigException("'" + field + "' must be an integer, got: " + node);
        }
        return node.asInt();
    }

    /** A variable is set if it is defined and non-blank. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }
}
