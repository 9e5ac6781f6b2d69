package sh.harold.hearth.world.session;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a session's handler stack: a handler plus the arguments it was pushed with.
 */
public record HandlerFrame(InputHandler handler, Map<String, String> args) {

    public HandlerFrame {
        Objects.requireNonNull(handler, "handler");
        args = args == null ? Map.of() : Map.copyOf(args);
    }

    public static HandlerFrame of(InputHandler handler) {
        return new HandlerFrame(handler, Map.of());
    }

    public HandlerFrame with(String key, String value) {
        Map<String, String> copy = new HashMap<>(args);
        copy.put(key, value);
        return new HandlerFrame(handler, copy);
    }

    public String arg(String key) {
        return args.get(key);
    }

    public String prompt() {
        return handler.prompt(this);
    }
}
