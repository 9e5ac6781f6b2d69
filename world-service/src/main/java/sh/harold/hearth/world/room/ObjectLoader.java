package sh.harold.hearth.world.room;

import java.util.Optional;

/**
 * Builds objects from the definitions found in room files.
 */
@FunctionalInterface
public interface ObjectLoader {

    /**
     * @return empty when the definition does not describe a usable object
     */
    Optional<ObjectRecord> load(ResetSpec spec);
}
