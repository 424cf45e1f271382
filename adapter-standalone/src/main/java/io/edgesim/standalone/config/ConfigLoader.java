package io.edgesim.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link EdgeConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code edge-sim.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Every scalar key can be overridden with an {@code EDGE_*} environment
 * variable, which takes precedence over the YAML value. A variable counts as
 * set only if its trimmed value is non-empty.
 *
 * <table>
 * <caption>Environment overrides</caption>
 * <tr><td>{@code EDGE_HOST}</td><td>server.host</td></tr>
 * <tr><td>{@code EDGE_PORT}</td><td>server.port</td></tr>
 * <tr><td>{@code EDGE_CACHE_DIR}</td><td>cache.dir</td></tr>
 * <tr><td>{@code EDGE_CACHE_KEY_HEADERS}</td><td>cache.key-headers (comma separated)</td></tr>
 * <tr><td>{@code EDGE_ORIGIN_CONNECT_TIMEOUT_MS}</td><td>origin.connect-timeout-ms</td></tr>
 * <tr><td>{@code EDGE_ORIGIN_READ_TIMEOUT_MS}</td><td>origin.read-timeout-ms</td></tr>
 * <tr><td>{@code EDGE_DISTRIBUTION_DOMAIN_NAME}</td><td>distribution.domain-name</td></tr>
 * <tr><td>{@code EDGE_DISTRIBUTION_ID}</td><td>distribution.id</td></tr>
 * <tr><td>{@code EDGE_REGISTRATION_STRICT}</td><td>registration.strict</td></tr>
 * <tr><td>{@code EDGE_LOG_FORMAT}</td><td>logging.format</td></tr>
 * <tr><td>{@code EDGE_LOG_LEVEL}</td><td>logging.level</td></tr>
 * <tr><td>{@code EDGE_ADMIN_RELOAD_PATH}</td><td>admin.reload-path</td></tr>
 * </table>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "edge-sim.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads an {@link EdgeConfig} from the given YAML file, applying overrides
     * from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the configuration with defaults applied
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static EdgeConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads an {@link EdgeConfig} from the given YAML file, applying overrides
     * from the supplied lookup. A {@code null} lookup result means the variable
     * is not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the configuration with env overrides applied
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static EdgeConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                root = YAML_MAPPER.createObjectNode();
            }
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
            }
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the path following {@code --config}, or {@code edge-sim.yaml}
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static EdgeConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EdgeConfig.Builder builder = EdgeConfig.builder();

        // --- YAML mapping ---

        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(server.get("port").asInt());

        JsonNode cache = root.path("cache");
        if (cache.has("dir")) builder.cacheDir(cache.get("dir").asText());
        if (cache.has("key-headers")) builder.cacheKeyHeaders(textList(cache.get("key-headers"), "cache.key-headers"));

        JsonNode origin = root.path("origin");
        if (origin.has("connect-timeout-ms"))
            builder.originConnectTimeoutMs(origin.get("connect-timeout-ms").asInt());
        if (origin.has("read-timeout-ms"))
            builder.originReadTimeoutMs(origin.get("read-timeout-ms").asInt());

        JsonNode distribution = root.path("distribution");
        if (distribution.has("domain-name"))
            builder.distributionDomainName(distribution.get("domain-name").asText());
        if (distribution.has("id")) builder.distributionId(distribution.get("id").asText());

        JsonNode registration = root.path("registration");
        if (registration.has("strict"))
            builder.strictRegistration(registration.get("strict").asBoolean());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        JsonNode admin = root.path("admin");
        if (admin.has("reload-path")) builder.adminReloadPath(admin.get("reload-path").asText());

        builder.behaviors(behaviors(root.path("behaviors")));
        builder.origins(origins(root.path("origins")));

        // --- Environment variable overlay ---
        envString(envLookup, "EDGE_HOST", builder::host);
        envInt(envLookup, "EDGE_PORT", builder::port);
        envString(envLookup, "EDGE_CACHE_DIR", builder::cacheDir);
        envString(envLookup, "EDGE_CACHE_KEY_HEADERS", value -> builder.cacheKeyHeaders(splitList(value)));
        envInt(envLookup, "EDGE_ORIGIN_CONNECT_TIMEOUT_MS", builder::originConnectTimeoutMs);
        envInt(envLookup, "EDGE_ORIGIN_READ_TIMEOUT_MS", builder::originReadTimeoutMs);
        envString(envLookup, "EDGE_DISTRIBUTION_DOMAIN_NAME", builder::distributionDomainName);
        envString(envLookup, "EDGE_DISTRIBUTION_ID", builder::distributionId);
        envBool(envLookup, "EDGE_REGISTRATION_STRICT", builder::strictRegistration);
        envString(envLookup, "EDGE_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "EDGE_LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "EDGE_ADMIN_RELOAD_PATH", builder::adminReloadPath);

        return builder.build();
    }

    private static List<BehaviorConfig> behaviors(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigLoadException("'behaviors' must be a list");
        }
        List<BehaviorConfig> result = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode entry = node.get(i);
            String pattern = textOrDefault(entry, "pattern", "*");
            String eventType = textOrNull(entry, "event-type");
            String handler = textOrNull(entry, "handler");
            if (eventType == null || eventType.isBlank()) {
                throw new ConfigLoadException("behaviors[" + i + "] is missing 'event-type'");
            }
            if (handler == null || handler.isBlank()) {
                throw new ConfigLoadException("behaviors[" + i + "] is missing 'handler'");
            }
            result.add(new BehaviorConfig(pattern, eventType.trim(), handler.trim()));
        }
        return result;
    }

    private static List<OriginMapping> origins(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigLoadException("'origins' must be a list");
        }
        List<OriginMapping> result = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode entry = node.get(i);
            String target = textOrNull(entry, "target");
            if (target == null || target.isBlank()) {
                throw new ConfigLoadException("origins[" + i + "] is missing 'target'");
            }
            result.add(new OriginMapping(
                    textOrDefault(entry, "path-pattern", "*"),
                    target.trim(),
                    entry.path("default").asBoolean(false)));
        }
        return result;
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.hasNonNull(field) ? node.get(field).asText() : defaultValue;
    }

    private static List<String> textList(JsonNode node, String key) {
        if (node.isTextual()) {
            return splitList(node.asText());
        }
        if (!node.isArray()) {
            throw new ConfigLoadException("'" + key + "' must be a list");
        }
        List<String> values = new ArrayList<>();
        node.forEach(element -> values.add(element.asText()));
        return values;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
