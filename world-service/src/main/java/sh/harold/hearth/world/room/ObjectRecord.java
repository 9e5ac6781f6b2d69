package sh.harold.hearth.world.room;

import java.util.Objects;

/**
 * An object lying in a room or carried by a living.
 *
 * @param name        short name players refer to it by
 * @param description text shown when the room is described
 * @param attached    attached objects are scenery and cannot be picked up
 */
public record ObjectRecord(String name, String description, boolean attached) {

    public ObjectRecord {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Object name must not be blank");
        }
        description = description == null ? "" : description;
    }

    public boolean matches(String query) {
        return query != null && name.equalsIgnoreCase(query.trim());
    }
}
