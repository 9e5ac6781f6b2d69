package sh.harold.hearth.world.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

final class FailurePolicies {

    private FailurePolicies() {
    }

    static <E extends Enum<E>> E parse(Class<E> type, String raw, String key) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException(key + " must not be empty");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            String allowed = Arrays.stream(type.getEnumConstants())
                    .map(constant -> constant.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException(key + " must be one of " + allowed + " but was '" + raw + "'");
        }
    }
}
