package sh.harold.hearth.world.room;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Snapshot of a room as seen by someone standing in it.
 */
public record RoomView(
        RoomId id,
        String title,
        String brief,
        String longDescription,
        Map<String, RoomId> exits,
        List<ObjectRecord> objects,
        List<String> occupants) {

    public RoomView {
        exits = Map.copyOf(exits);
        objects = List.copyOf(objects);
        occupants = List.copyOf(occupants);
    }

    /**
     * Renders the room for {@code viewer}, who is left out of the occupant line.
     */
    public String render(String viewer) {
        StringBuilder sb = new StringBuilder();
        sb.append(title).append('\n');
        sb.append(longDescription != null ? longDescription : brief);

        for (ObjectRecord object : objects) {
            if (!object.description().isEmpty()) {
                sb.append('\n').append(object.description());
            }
        }

        List<String> loose = objects.stream()
                .filter(object -> !object.attached())
                .map(ObjectRecord::name)
                .collect(Collectors.toList());
        if (!loose.isEmpty()) {
            sb.append("\nYou see: ").append(String.join(", ", loose)).append('.');
        }

        if (exits.isEmpty()) {
            sb.append("\nThere are no obvious exits.");
        } else {
            sb.append("\nExits: ").append(String.join(", ", exits.keySet().stream().sorted().collect(Collectors.toList()))).append('.');
        }

        List<String> others = occupants.stream()
                .filter(name -> !name.equalsIgnoreCase(viewer))
                .collect(Collectors.toList());
        if (!others.isEmpty()) {
            sb.append("\nAlso here: ").append(String.join(", ", others)).append('.');
        }
        return sb.toString();
    }
}
