package sh.harold.hearth.world.config;

import sh.harold.hearth.world.room.RoomId;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings of a world server process.
 */
public record WorldConfig(
        int port,
        Path dataDirectory,
        RoomId startRoom,
        Duration callTimeout,
        Duration requestTimeout,
        boolean debug,
        LivingFailurePolicy livingPolicy,
        UserFailurePolicy userPolicy,
        boolean consoleEnabled) {

    public static final int DEFAULT_PORT = 4000;
    public static final String DEFAULT_DATA_DIRECTORY = "./data";
    public static final String DEFAULT_START_ROOM = "square";
    public static final long DEFAULT_CALL_TIMEOUT_MS = 5000;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 10000;

    public WorldConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("world.port must be between 0 and 65535 but was " + port);
        }
        Objects.requireNonNull(dataDirectory, "dataDirectory");
        Objects.requireNonNull(startRoom, "startRoom");
        requirePositive(callTimeout, "world.call-timeout-ms");
        requirePositive(requestTimeout, "world.request-timeout-ms");
        Objects.requireNonNull(livingPolicy, "livingPolicy");
        Objects.requireNonNull(userPolicy, "userPolicy");
    }

    public static WorldConfig defaults() {
        return new WorldConfig(
                DEFAULT_PORT,
                Path.of(DEFAULT_DATA_DIRECTORY),
                RoomId.of(DEFAULT_START_ROOM),
                Duration.ofMillis(DEFAULT_CALL_TIMEOUT_MS),
                Duration.ofMillis(DEFAULT_REQUEST_TIMEOUT_MS),
                false,
                LivingFailurePolicy.DISCONNECT,
                UserFailurePolicy.DISCONNECT,
                true
        );
    }

    public WorldConfig withPort(int newPort) {
        return new WorldConfig(newPort, dataDirectory, startRoom, callTimeout, requestTimeout, debug,
                livingPolicy, userPolicy, consoleEnabled);
    }

    public WorldConfig withDataDirectory(Path directory) {
        return new WorldConfig(port, directory, startRoom, callTimeout, requestTimeout, debug,
                livingPolicy, userPolicy, consoleEnabled);
    }

    public WorldConfig withRequestTimeout(Duration timeout) {
        return new WorldConfig(port, dataDirectory, startRoom, callTimeout, timeout, debug,
                livingPolicy, userPolicy, consoleEnabled);
    }

    public WorldConfig withPolicies(LivingFailurePolicy living, UserFailurePolicy user) {
        return new WorldConfig(port, dataDirectory, startRoom, callTimeout, requestTimeout, debug,
                living, user, consoleEnabled);
    }

    private static void requirePositive(Duration duration, String key) {
        Objects.requireNonNull(duration, key);
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(key + " must be positive");
        }
    }
}
