package sh.harold.hearth.world;

import sh.harold.hearth.actor.ActorRuntime;
import sh.harold.hearth.world.config.LivingFailurePolicy;
import sh.harold.hearth.world.config.UserFailurePolicy;
import sh.harold.hearth.world.config.WorldConfig;
import sh.harold.hearth.world.game.GameRegistry;
import sh.harold.hearth.world.room.FileRoomStore;
import sh.harold.hearth.world.room.RoomId;
import sh.harold.hearth.world.room.RoomManager;
import sh.harold.hearth.world.user.InMemoryAccountStore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * A small world on disk plus the services around it.
 *
 * <pre>
 *   square --east--> market --south--> docks
 *     |  \--west--> garden (no file)
 *     north
 *   tavern
 * </pre>
 */
public final class TestWorld implements AutoCloseable {

    public final Path dataDirectory;
    public final ActorRuntime runtime;
    public final WorldConfig config;
    public final WorldServices services;

    private TestWorld(Path dataDirectory, WorldConfig config) {
        this.dataDirectory = dataDirectory;
        this.config = config;
        this.runtime = new ActorRuntime("test-world");
        RoomManager rooms = new RoomManager(runtime, new FileRoomStore(dataDirectory), config.callTimeout());
        GameRegistry games = new GameRegistry(runtime, config.callTimeout());
        this.services = new WorldServices(runtime, config, rooms, games, new InMemoryAccountStore());
    }

    public static TestWorld create(Path dataDirectory) {
        return create(dataDirectory, LivingFailurePolicy.DISCONNECT, UserFailurePolicy.DISCONNECT, Duration.ofSeconds(5));
    }

    public static TestWorld create(Path dataDirectory, LivingFailurePolicy living, UserFailurePolicy user,
                                   Duration requestTimeout) {
        writeSampleRooms(dataDirectory);
        WorldConfig config = WorldConfig.defaults()
                .withPort(0)
                .withDataDirectory(dataDirectory)
                .withRequestTimeout(requestTimeout)
                .withPolicies(living, user);
        return new TestWorld(dataDirectory, config);
    }

    public static void writeSampleRooms(Path dataDirectory) {
        writeRoom(dataDirectory, "square", """
                {
                  "title": "The Town Square",
                  "desc": "A cobbled square.",
                  "exits": [
                    { "direction": "east", "room": "market" },
                    { "direction": "north", "room": "tavern" },
                    { "direction": "west", "room": "garden" }
                  ],
                  "objects": [
                    { "name": "fountain", "desc": "An old fountain.", "attached": true },
                    { "name": "pebble", "desc": "A grey pebble." }
                  ]
                }
                """);
        writeRoom(dataDirectory, "market", """
                {
                  "title": "The Market",
                  "desc": "Stalls everywhere.",
                  "exits": [
                    { "direction": "west", "room": "square" },
                    { "direction": "south", "room": "docks" }
                  ]
                }
                """);
        writeRoom(dataDirectory, "tavern", """
                {
                  "title": "The Copper Kettle",
                  "desc": "A smoky taproom.",
                  "exits": [ { "direction": "south", "room": "square" } ]
                }
                """);
        writeRoom(dataDirectory, "docks", """
                {
                  "title": "The Docks",
                  "desc": "Grey water.",
                  "exits": [ { "direction": "north", "room": "market" } ]
                }
                """);
    }

    public static Path writeRoom(Path dataDirectory, String id, String json) {
        try {
            Path rooms = Files.createDirectories(dataDirectory.resolve(FileRoomStore.ROOM_DIRECTORY));
            return Files.writeString(rooms.resolve(id + FileRoomStore.FILE_EXTENSION), json);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static RoomId room(String id) {
        return RoomId.of(id);
    }

    public static void waitFor(BooleanSupplier condition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within " + timeout);
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("interrupted while waiting", e);
            }
        }
    }

    @Override
    public void close() {
        runtime.shutdown(Duration.ofSeconds(2));
    }
}
