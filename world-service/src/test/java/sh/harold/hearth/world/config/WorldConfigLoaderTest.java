package sh.harold.hearth.world.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sh.harold.hearth.world.room.RoomId;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class WorldConfigLoaderTest {

    private final WorldConfigLoader noEnvironment = new WorldConfigLoader(name -> null);

    @Test
    void bundledConfigurationMatchesTheDefaults() throws IOException {
        WorldConfig config = noEnvironment.load(null);

        assertThat(config.port()).isEqualTo(WorldConfig.DEFAULT_PORT);
        assertThat(config.startRoom()).isEqualTo(RoomId.of("square"));
        assertThat(config.callTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.livingPolicy()).isEqualTo(LivingFailurePolicy.DISCONNECT);
        assertThat(config.userPolicy()).isEqualTo(UserFailurePolicy.DISCONNECT);
        assertThat(config.consoleEnabled()).isTrue();
        assertThat(config.debug()).isFalse();
    }

    @Test
    void environmentOverridesPlaceholders() throws IOException {
        Map<String, String> env = Map.of(
                "HEARTH_PORT", "4100",
                "HEARTH_LIVING_FAILURE", "respawn",
                "HEARTH_USER_FAILURE", "Reauthenticate",
                "HEARTH_CONSOLE", "false");

        WorldConfig config = new WorldConfigLoader(env::get).load(null);

        assertThat(config.port()).isEqualTo(4100);
        assertThat(config.livingPolicy()).isEqualTo(LivingFailurePolicy.RESPAWN);
        assertThat(config.userPolicy()).isEqualTo(UserFailurePolicy.REAUTHENTICATE);
        assertThat(config.consoleEnabled()).isFalse();
    }

    @Test
    void missingKeysFallBackToDefaults() {
        WorldConfig config = parse("world:\n  port: 5000\n");

        assertThat(config.port()).isEqualTo(5000);
        assertThat(config.dataDirectory()).isEqualTo(WorldConfig.defaults().dataDirectory());
        assertThat(config.livingPolicy()).isEqualTo(LivingFailurePolicy.DISCONNECT);
        assertThat(parse("")).isEqualTo(WorldConfig.defaults());
    }

    @Test
    void readsAFileFromDisk(@TempDir Path directory) throws IOException {
        Path file = Files.writeString(directory.resolve("world.yml"),
                "world:\n  data-dir: /srv/hearth\n  start-room: tavern\n  request-timeout-ms: 250\n");

        WorldConfig config = noEnvironment.load(file);

        assertThat(config.dataDirectory()).isEqualTo(Path.of("/srv/hearth"));
        assertThat(config.startRoom()).isEqualTo(RoomId.of("tavern"));
        assertThat(config.requestTimeout()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void rejectsUnknownPolicies() {
        assertThatThrownBy(() -> parse("supervision:\n  living: resurrect\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("supervision.living")
                .hasMessageContaining("disconnect, respawn");
    }

    @Test
    void rejectsBadNumbersAndFlags() {
        assertThatThrownBy(() -> parse("world:\n  port: lots\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("port");
        assertThatThrownBy(() -> parse("world:\n  port: 70000\n"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse("world:\n  request-timeout-ms: 0\n"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse("console:\n  enabled: maybe\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("enabled");
    }

    @Test
    void rejectsInvalidStartRoom() {
        assertThatThrownBy(() -> parse("world:\n  start-room: \"../etc\"\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("start-room");
    }

    private WorldConfig parse(String yaml) {
        InputStream in = new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
        return noEnvironment.parse(in);
    }
}
