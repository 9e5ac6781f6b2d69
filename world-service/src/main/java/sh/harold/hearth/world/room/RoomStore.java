package sh.harold.hearth.world.room;

import java.util.Optional;

/**
 * Source of persisted room definitions.
 */
public interface RoomStore {

    /**
     * Loads the definition of a room.
     *
     * @return empty when no definition exists or it cannot be read
     */
    Optional<RoomRecord> load(RoomId id);
}
