package sh.harold.hearth.world;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sh.harold.hearth.world.config.LivingFailurePolicy;
import sh.harold.hearth.world.config.UserFailurePolicy;
import sh.harold.hearth.world.config.WorldConfig;
import sh.harold.hearth.world.room.RoomId;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class WorldServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path dataDirectory;

    private WorldService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.shutdown();
        }
    }

    @Test
    void refusesToStartWithoutItsStartRoom() {
        TestWorld.writeSampleRooms(dataDirectory);
        WorldConfig config = new WorldConfig(0, dataDirectory, RoomId.of("garden"), Duration.ofSeconds(5),
                Duration.ofSeconds(10), false, LivingFailurePolicy.DISCONNECT, UserFailurePolicy.DISCONNECT, false);
        service = new WorldService(config);

        assertThatThrownBy(service::startServices)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("garden");
    }

    @Test
    void playerConnectsLogsInAndQuits() throws Exception {
        service = startWorld();

        try (Socket socket = new Socket("localhost", service.boundPort())) {
            socket.setSoTimeout((int) TIMEOUT.toMillis());
            Reader in = new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8);
            OutputStream out = socket.getOutputStream();

            assertThat(readUntil(in, "By what name are you known? ")).contains("Welcome to Hearth.");
            send(out, "Ann");
            readUntil(in, "Choose a password: ");
            send(out, "secret");
            assertThat(readUntil(in, "> ")).contains("Welcome, Ann.").contains("The Town Square");
            assertThat(service.services().games().onlineUsers()).containsExactly("Ann");

            send(out, "east");
            assertThat(readUntil(in, "> ")).contains("The Market");

            send(out, "quit");
            assertThat(readUntil(in, "Goodbye.")).endsWith("Goodbye.");
            TestWorld.waitFor(() -> !service.services().games().isOnline("Ann"), TIMEOUT);
        }
    }

    @Test
    void droppedConnectionTakesThePlayerOffline() throws Exception {
        service = startWorld();

        try (Socket socket = new Socket("localhost", service.boundPort())) {
            socket.setSoTimeout((int) TIMEOUT.toMillis());
            Reader in = new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8);
            OutputStream out = socket.getOutputStream();
            readUntil(in, "By what name are you known? ");
            send(out, "Bob");
            readUntil(in, "Choose a password: ");
            send(out, "hunter2");
            readUntil(in, "Welcome, Bob.");
        }

        TestWorld.waitFor(() -> !service.services().games().isOnline("Bob"), TIMEOUT);
        assertThat(service.services().accounts().find("Bob")).isPresent();
    }

    @Test
    void debugModeToggles() throws Exception {
        service = startWorld();

        assertThat(service.isDebugMode()).isFalse();
        assertThat(service.toggleDebugMode()).isTrue();
        assertThat(service.toggleDebugMode()).isFalse();
    }

    @Test
    void shutdownStopsEverything() throws Exception {
        service = startWorld();

        service.shutdown();
        service.shutdown();

        assertThat(service.isStopped()).isTrue();
        assertThat(service.services().runtime().isRunning()).isFalse();
    }

    private WorldService startWorld() throws IOException {
        TestWorld.writeSampleRooms(dataDirectory);
        WorldConfig config = new WorldConfig(0, dataDirectory, RoomId.of("square"), Duration.ofSeconds(5),
                Duration.ofSeconds(10), false, LivingFailurePolicy.DISCONNECT, UserFailurePolicy.DISCONNECT, false);
        WorldService world = new WorldService(config);
        world.startServices();
        return world;
    }

    private static void send(OutputStream out, String line) throws IOException {
        out.write((line + "\r\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private static String readUntil(Reader in, String marker) throws IOException {
        StringBuilder text = new StringBuilder();
        while (!text.toString().endsWith(marker)) {
            int c = in.read();
            if (c < 0) {
                throw new AssertionError("connection closed before '" + marker + "', got: " + text);
            }
            text.append((char) c);
        }
        return text.toString();
    }
}
