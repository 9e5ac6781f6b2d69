package sh.harold.hearth.world.room;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link RoomManager#getRoom(RoomId)} and {@link RoomManager#newRoom(RoomId)}.
 */
public sealed interface RoomResult permits RoomResult.Found, RoomResult.Failed {

    static RoomResult found(RoomHandle room) {
        return new Found(room);
    }

    static RoomResult notFound() {
        return new Failed(RoomError.NOT_FOUND);
    }

    static RoomResult alreadyExists() {
        return new Failed(RoomError.ALREADY_EXISTS);
    }

    default boolean isFound() {
        return this instanceof Found;
    }

    default Optional<RoomHandle> handle() {
        return this instanceof Found found ? Optional.of(found.room()) : Optional.empty();
    }

    record Found(RoomHandle room) implements RoomResult {
        public Found {
            Objects.requireNonNull(room, "room");
        }
    }

    record Failed(RoomError error) implements RoomResult {
        public Failed {
            Objects.requireNonNull(error, "error");
        }
    }
}
