package sh.harold.hearth.world.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import sh.harold.hearth.world.room.RoomId;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Reads {@link WorldConfig} from YAML.
 *
 * <p>String values of the form {@code ${NAME:default}} are replaced by the
 * environment variable {@code NAME}, or by {@code default} when it is unset.
 * Missing keys fall back to {@link WorldConfig#defaults()}; present but invalid
 * values are rejected with {@link IllegalArgumentException}.
 */
public final class WorldConfigLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorldConfigLoader.class);
    private static final String CLASSPATH_RESOURCE = "/application.yml";

    private final Function<String, String> environment;

    public WorldConfigLoader() {
        this(System::getenv);
    }

    public WorldConfigLoader(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /**
     * Loads {@code file} when given, the bundled {@code application.yml} otherwise.
     */
    public WorldConfig load(Path file) throws IOException {
        if (file != null) {
            LOGGER.info("Loading configuration from {}", file.toAbsolutePath());
            try (InputStream in = Files.newInputStream(file)) {
                return parse(in);
            }
        }
        try (InputStream in = WorldConfigLoader.class.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) {
                LOGGER.warn("application.yml not found, using default configuration");
                return WorldConfig.defaults();
            }
            return parse(in);
        }
    }

    public WorldConfig parse(InputStream in) {
        Object loaded = new Yaml().load(in);
        if (loaded == null) {
            return WorldConfig.defaults();
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("configuration root must be a mapping");
        }
        Map<String, Object> root = substitute(map);
        return fromMap(root);
    }

    WorldConfig fromMap(Map<String, Object> root) {
        WorldConfig defaults = WorldConfig.defaults();
        Map<String, Object> world = section(root, "world");
        Map<String, Object> supervision = section(root, "supervision");
        Map<String, Object> console = section(root, "console");

        int port = intValue(world, "port", defaults.port());
        Path dataDirectory = Path.of(stringValue(world, "data-dir", defaults.dataDirectory().toString()));
        RoomId startRoom = roomValue(world, "start-room", defaults.startRoom());
        Duration callTimeout = Duration.ofMillis(longValue(world, "call-timeout-ms", defaults.callTimeout().toMillis()));
        Duration requestTimeout = Duration.ofMillis(longValue(world, "request-timeout-ms", defaults.requestTimeout().toMillis()));
        boolean debug = booleanValue(world, "debug", defaults.debug());

        LivingFailurePolicy livingPolicy = supervision.containsKey("living")
                ? LivingFailurePolicy.parse(String.valueOf(supervision.get("living")))
                : defaults.livingPolicy();
        UserFailurePolicy userPolicy = supervision.containsKey("user")
                ? UserFailurePolicy.parse(String.valueOf(supervision.get("user")))
                : defaults.userPolicy();
        boolean consoleEnabled = booleanValue(console, "enabled", defaults.consoleEnabled());

        return new WorldConfig(port, dataDirectory, startRoom, callTimeout, requestTimeout, debug,
                livingPolicy, userPolicy, consoleEnabled);
    }

    private Map<String, Object> substitute(Map<?, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                value = substitute(nested);
            } else if (value instanceof String text) {
                value = resolveEnvironment(text);
            }
            result.put(String.valueOf(entry.getKey()), value);
        }
        return result;
    }

    private String resolveEnvironment(String value) {
        if (!value.startsWith("${") || !value.endsWith("}")) {
            return value;
        }
        String envVarWithDefault = value.substring(2, value.length() - 1);
        String[] parts = envVarWithDefault.split(":", 2);
        String fromEnvironment = environment.apply(parts[0]);
        if (fromEnvironment != null) {
            return fromEnvironment;
        }
        return parts.length > 1 ? parts[1] : "";
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> root, String key) {
        Object value = root.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("'" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static String stringValue(Map<String, Object> section, String key, String fallback) {
        Object value = section.get(key);
        if (value == null || value.toString().isBlank()) {
            return fallback;
        }
        return value.toString().trim();
    }

    private static int intValue(Map<String, Object> section, String key, int fallback) {
        long value = longValue(section, key, fallback);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new IllegalArgumentException("'" + key + "' is out of range: " + value);
        }
        return (int) value;
    }

    private static long longValue(Map<String, Object> section, String key, long fallback) {
        Object value = section.get(key);
        if (value == null || value.toString().isBlank()) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be a number but was '" + value + "'", e);
        }
    }

    private static boolean booleanValue(Map<String, Object> section, String key, boolean fallback) {
        Object value = section.get(key);
        if (value == null || value.toString().isBlank()) {
            return fallback;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true")) {
            return true;
        }
        if (text.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("'" + key + "' must be true or false but was '" + value + "'");
    }

    private static RoomId roomValue(Map<String, Object> section, String key, RoomId fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        return RoomId.parse(value.toString())
                .orElseThrow(() -> new IllegalArgumentException("'" + key + "' is not a valid room id: '" + value + "'"));
    }
}
