package sh.harold.hearth.world.room;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Reads {@code name}, {@code desc} and {@code attached} from an object definition.
 */
public final class DefaultObjectLoader implements ObjectLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultObjectLoader.class);

    @Override
    public Optional<ObjectRecord> load(ResetSpec spec) {
        String name = spec.string("name");
        if (name == null || name.isBlank()) {
            LOGGER.debug("Skipping object definition without a name: {}", spec.properties());
            return Optional.empty();
        }
        return Optional.of(new ObjectRecord(name.trim(), spec.string("desc"), spec.flag("attached")));
    }
}
