package sh.harold.hearth.world.room;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the JSON tree of a room file into a {@link RoomRecord}.
 *
 * <pre>
 * {
 *   "title": "The Town Square",
 *   "desc": "A busy square.",
 *   "long": "Optional longer text.",
 *   "exits": [ { "direction": "east", "room": "market" } ],
 *   "objects": [ { "name": "fountain", "desc": "An old fountain.", "attached": true } ]
 * }
 * </pre>
 */
final class RoomFileParser {
    private static final TypeReference<Map<String, Object>> PROPERTIES = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final ObjectLoader objectLoader;

    RoomFileParser(ObjectMapper mapper, ObjectLoader objectLoader) {
        this.mapper = mapper;
        this.objectLoader = objectLoader;
    }

    RoomRecord parse(RoomId id, JsonNode root) throws RoomFormatException {
        if (root == null || !root.isObject()) {
            throw new RoomFormatException("room definition must be a JSON object");
        }
        String title = requiredText(root, "title");
        String brief = requiredText(root, "desc");
        String longDescription = optionalText(root, "long");

        Map<String, RoomId> exits = parseExits(root.get("exits"));

        List<ResetSpec> resets = new ArrayList<>();
        List<ObjectRecord> objects = new ArrayList<>();
        JsonNode objectsNode = root.get("objects");
        if (objectsNode != null && !objectsNode.isNull()) {
            if (!objectsNode.isArray()) {
                throw new RoomFormatException("'objects' must be a list");
            }
            for (JsonNode objectNode : objectsNode) {
                if (!objectNode.isObject()) {
                    throw new RoomFormatException("object entries must be JSON objects");
                }
                ResetSpec spec = new ResetSpec(mapper.convertValue(objectNode, PROPERTIES));
                resets.add(spec);
                objectLoader.load(spec).ifPresent(objects::add);
            }
        }

        return new RoomRecord(id, title, brief, longDescription, exits, objects, resets);
    }

    private Map<String, RoomId> parseExits(JsonNode exitsNode) throws RoomFormatException {
        if (exitsNode == null || exitsNode.isNull()) {
            throw new RoomFormatException("missing required field 'exits'");
        }
        Map<String, RoomId> exits = new LinkedHashMap<>();
        if (!exitsNode.isArray()) {
            throw new RoomFormatException("'exits' must be a list");
        }
        for (JsonNode exitNode : exitsNode) {
            String direction = requiredText(exitNode, "direction").toLowerCase(Locale.ROOT);
            String target = requiredText(exitNode, "room");
            Optional<RoomId> destination = RoomId.parse(target);
            if (destination.isEmpty()) {
                throw new RoomFormatException("exit '" + direction + "' points at invalid room '" + target + "'");
            }
            if (exits.putIfAbsent(direction, destination.get()) != null) {
                throw new RoomFormatException("duplicate exit '" + direction + "'");
            }
        }
        return exits;
    }

    private static String requiredText(JsonNode node, String field) throws RoomFormatException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new RoomFormatException("missing or empty '" + field + "'");
        }
        return value.asText().trim();
    }

    private static String optionalText(JsonNode node, String field) throws RoomFormatException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new RoomFormatException("'" + field + "' must be text");
        }
        return value.asText().isBlank() ? null : value.asText();
    }
}
