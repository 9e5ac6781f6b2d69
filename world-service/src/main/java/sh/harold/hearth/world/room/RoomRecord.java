package sh.harold.hearth.world.room;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable room definition as loaded from storage.
 *
 * @param longDescription optional, {@code null} when the room only has a brief
 */
public record RoomRecord(
        RoomId id,
        String title,
        String brief,
        String longDescription,
        Map<String, RoomId> exits,
        List<ObjectRecord> objects,
        List<ResetSpec> resets) {

    public RoomRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(brief, "brief");
        exits = exits == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(exits));
        objects = objects == null ? List.of() : List.copyOf(objects);
        resets = resets == null ? List.of() : List.copyOf(resets);
    }

    public static RoomRecord blank(RoomId id, String title, String brief) {
        return new RoomRecord(id, title, brief, null, Map.of(), List.of(), List.of());
    }
}
