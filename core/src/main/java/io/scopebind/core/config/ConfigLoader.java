package io.scopebind.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link BindingsConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * YAML layout:
 *
 * <pre>
 * scope:
 *   collection-component: ws:collection
 * expressions:
 *   max-length: 10000
 *   max-depth: 64
 *   effect-calls: [setState]
 * </pre>
 *
 * <p>
 * Missing keys receive the defaults of {@link BindingsConfig.Builder}. Environment variables
 * take precedence over YAML values. An env var is considered "set" if and only if it is defined
 * AND its trimmed value is non-empty; empty or whitespace-only values are treated as "unset".
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_RESOURCE = "scope-bind.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link BindingsConfig} from the given YAML file, applying environment variable
     * overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the configuration with defaults applied
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static BindingsConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link BindingsConfig} from the given YAML file, applying environment variable
     * overrides from the supplied lookup function. Returning {@code null} from the lookup means
     * the variable is not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the configuration with env overrides applied
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static BindingsConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            return fromYaml(in, configPath.toString(), envLookup);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read configuration: " + configPath, e);
        }
    }

    /**
     * Loads {@code scope-bind.yaml} from the classpath if present, otherwise the defaults, and
     * applies environment variable overrides from {@link System#getenv}.
     *
     * @return the configuration
     * @throws ConfigLoadException if the classpath resource contains invalid YAML
     */
    public static BindingsConfig loadDefault() {
        return loadDefault(System::getenv);
    }

    static BindingsConfig loadDefault(Function<String, String> envLookup) {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                LOG.debug("No {} on the classpath, using defaults", DEFAULT_CONFIG_RESOURCE);
                return toConfig(YAML_MAPPER.createObjectNode(), "defaults", envLookup);
            }
            return fromYaml(in, "classpath:" + DEFAULT_CONFIG_RESOURCE, envLookup);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read classpath:" + DEFAULT_CONFIG_RESOURCE, e);
        }
    }

    private static BindingsConfig fromYaml(InputStream in, String source, Function<String, String> envLookup) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + source, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        } else if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + source);
        }
        return toConfig(root, source, envLookup);
    }

    private static BindingsConfig toConfig(JsonNode root, String source, Function<String, String> envLookup) {
        try {
            BindingsConfig config = mapToConfig(root, envLookup);
            LOG.debug("Loaded configuration from {}: {}", source, config);
            return config;
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /** Maps a parsed YAML tree to a {@link BindingsConfig}, then overlays env var overrides. */
    private static BindingsConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        BindingsConfig.Builder builder = BindingsConfig.builder();

        // --- YAML mapping ---

        JsonNode scope = root.path("scope");
        if (scope.has("collection-component"))
            builder.collectionComponent(scope.get("collection-component").asText());

        JsonNode expressions = root.path("expressions");
        if (expressions.has("max-length"))
            builder.maxExpressionLength(intValue(expressions, "max-length"));
        if (expressions.has("max-depth")) builder.maxNestingDepth(intValue(expressions, "max-depth"));
        if (expressions.has("effect-calls")) {
            JsonNode calls = expressions.get("effect-calls");
            if (!calls.isArray()) {
                throw new IllegalArgumentException("expressions.effect-calls must be a list");
            }
            Set<String> effectCalls = new LinkedHashSet<>();
            calls.forEach(call -> effectCalls.add(call.asText()));
            builder.effectCalls(effectCalls);
        }

        // --- Environment variable overlay ---

        envString(envLookup, "SCOPEBIND_COLLECTION_COMPONENT", builder::collectionComponent);
        envInt(envLookup, "SCOPEBIND_EXPRESSION_MAX_LENGTH", builder::maxExpressionLength);
        envInt(envLookup, "SCOPEBIND_EXPRESSION_MAX_DEPTH", builder::maxNestingDepth);
        envString(envLookup, "SCOPEBIND_EFFECT_CALLS", value -> builder.effectCalls(splitList(value)));

        return builder.build();
    }

    private static Set<String> splitList(String value) {
        Set<String> items = new LinkedHashSet<>();
        for (String item : value.split(",")) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is "set": defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies an integer env var override if set. */
    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    // --- YAML helpers ---

    private static int intValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IllegalArgumentException(field + " must be an integer, got " + value);
        }
        return value.intValue();
    }
}
