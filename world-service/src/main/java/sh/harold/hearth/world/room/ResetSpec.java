package sh.harold.hearth.world.room;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Raw object definition as it appears in a room file. Turned into an
 * {@link ObjectRecord} by an {@link ObjectLoader}; kept on the room so it can
 * be replayed later.
 */
public record ResetSpec(Map<String, Object> properties) {

    public ResetSpec {
        Objects.requireNonNull(properties, "properties");
        properties = Map.copyOf(new LinkedHashMap<>(properties));
    }

    public String string(String key) {
        Object value = properties.get(key);
        return value == null ? null : value.toString();
    }

    public boolean flag(String key) {
        Object value = properties.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }
}
