package sh.harold.hearth.world.room;

import java.util.Objects;
import java.util.Optional;

/**
 * Name of a room. Doubles as the file name of the room's definition, so it may not
 * contain path separators or parent references.
 */
public record RoomId(String value) implements Comparable<RoomId> {

    public RoomId {
        Objects.requireNonNull(value, "value");
        value = value.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Room id must not be blank");
        }
        if (value.indexOf('/') >= 0 || value.indexOf('\\') >= 0 || value.contains("..") || value.startsWith(".")) {
            throw new IllegalArgumentException("Invalid room id: " + value);
        }
    }

    public static RoomId of(String value) {
        return new RoomId(value);
    }

    /**
     * Lenient variant for untrusted input such as exit targets read from disk.
     */
    public static Optional<RoomId> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new RoomId(raw));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    @Override
    public int compareTo(RoomId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
