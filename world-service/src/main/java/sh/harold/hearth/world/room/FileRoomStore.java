package sh.harold.hearth.world.room;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads room definitions from {@code <data-dir>/rooms/<id>.dat}.
 *
 * <p>Unreadable or malformed files are reported and treated as absent, so a broken
 * room never gets spawned with half its state.
 */
public final class FileRoomStore implements RoomStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileRoomStore.class);

    public static final String ROOM_DIRECTORY = "rooms";
    public static final String FILE_EXTENSION = ".dat";

    private final Path roomDirectory;
    private final ObjectMapper mapper;
    private final RoomFileParser parser;

    public FileRoomStore(Path dataDirectory) {
        this(dataDirectory, new DefaultObjectLoader(), new ObjectMapper());
    }

    public FileRoomStore(Path dataDirectory, ObjectLoader objectLoader, ObjectMapper mapper) {
        Objects.requireNonNull(dataDirectory, "dataDirectory");
        this.roomDirectory = dataDirectory.resolve(ROOM_DIRECTORY);
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.parser = new RoomFileParser(mapper, Objects.requireNonNull(objectLoader, "objectLoader"));
    }

    public Path roomDirectory() {
        return roomDirectory;
    }

    public Path pathOf(RoomId id) {
        return roomDirectory.resolve(id.value() + FILE_EXTENSION);
    }

    /**
     * Recovers the room id from a room file name.
     */
    public static Optional<RoomId> roomIdOf(Path file) {
        if (file == null || file.getFileName() == null) {
            return Optional.empty();
        }
        String fileName = file.getFileName().toString();
        if (!fileName.endsWith(FILE_EXTENSION)) {
            return Optional.empty();
        }
        return RoomId.parse(fileName.substring(0, fileName.length() - FILE_EXTENSION.length()));
    }

    @Override
    public Optional<RoomRecord> load(RoomId id) {
        Path file = pathOf(id);
        if (!Files.isRegularFile(file)) {
            LOGGER.debug("No room file for {} at {}", id, file);
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            LOGGER.warn("Failed to read room file {}: {}", file, e.getMessage());
            return Optional.empty();
        }

        try {
            return Optional.of(parser.parse(id, root));
        } catch (RoomFormatException e) {
            LOGGER.warn("Rejecting room file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
