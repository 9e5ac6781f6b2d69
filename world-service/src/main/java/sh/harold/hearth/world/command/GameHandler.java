package sh.harold.hearth.world.command;

import sh.harold.hearth.world.living.LivingHandle;
import sh.harold.hearth.world.living.MoveOutcome;
import sh.harold.hearth.world.room.ObjectRecord;
import sh.harold.hearth.world.session.HandlerFrame;
import sh.harold.hearth.world.session.InputHandler;
import sh.harold.hearth.world.session.RequestContext;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * In-game command interpreter.
 */
public final class GameHandler implements InputHandler {

    static final Map<String, String> DIRECTIONS = Map.ofEntries(
            Map.entry("n", "north"), Map.entry("north", "north"),
            Map.entry("s", "south"), Map.entry("south", "south"),
            Map.entry("e", "east"), Map.entry("east", "east"),
            Map.entry("w", "west"), Map.entry("west", "west"),
            Map.entry("ne", "northeast"), Map.entry("northeast", "northeast"),
            Map.entry("nw", "northwest"), Map.entry("northwest", "northwest"),
            Map.entry("se", "southeast"), Map.entry("southeast", "southeast"),
            Map.entry("sw", "southwest"), Map.entry("southwest", "southwest"),
            Map.entry("u", "up"), Map.entry("up", "up"),
            Map.entry("d", "down"), Map.entry("down", "down"),
            Map.entry("in", "in"), Map.entry("out", "out"));

    static final String HELP = String.join("\n",
            "Commands:",
            "  look                 describe your surroundings",
            "  north, n, go <dir>   walk through an exit",
            "  take <item>          pick something up",
            "  drop <item>          put something down",
            "  inventory, i         list what you carry",
            "  say <text>, '<text>  talk to the room",
            "  who                  list players online",
            "  logout               return to the login prompt",
            "  quit                 leave the game");

    @Override
    public void handle(RequestContext context, String line) {
        String input = line.trim();
        if (input.isEmpty()) {
            return;
        }
        if (input.startsWith("'")) {
            say(context, input.substring(1).trim());
            return;
        }

        String[] parts = input.split("\\s+", 2);
        String verb = parts[0].toLowerCase(Locale.ROOT);
        String rest = parts.length > 1 ? parts[1].trim() : "";

        String direction = DIRECTIONS.get(verb);
        if (direction != null) {
            move(context, direction);
            return;
        }

        switch (verb) {
            case "look":
            case "l":
                context.write(context.living().look());
                break;
            case "go":
                if (rest.isEmpty()) {
                    context.write("Go where?");
                } else {
                    move(context, DIRECTIONS.getOrDefault(rest.toLowerCase(Locale.ROOT), rest.toLowerCase(Locale.ROOT)));
                }
                break;
            case "take":
            case "get":
                if (rest.isEmpty()) {
                    context.write("Take what?");
                } else {
                    context.write(context.living().take(rest));
                }
                break;
            case "drop":
                if (rest.isEmpty()) {
                    context.write("Drop what?");
                } else {
                    context.write(context.living().drop(rest));
                }
                break;
            case "inventory":
            case "inv":
            case "i":
                inventory(context, context.living());
                break;
            case "say":
                say(context, rest);
                break;
            case "who":
                List<String> online = context.services().games().onlineUsers();
                context.write("Players online (" + online.size() + "): " + String.join(", ", online));
                break;
            case "help":
            case "?":
                context.write(HELP);
                break;
            case "logout":
                context.write("You fade out of the world.");
                context.logout();
                break;
            case "quit":
                context.disconnect("Goodbye.");
                break;
            default:
                context.write("Huh?");
                break;
        }
    }

    private void move(RequestContext context, String direction) {
        MoveOutcome outcome = context.living().move(direction);
        context.write(outcome.message());
    }

    private void say(RequestContext context, String text) {
        if (text.isEmpty()) {
            context.write("Say what?");
            return;
        }
        context.living().say(text);
        context.write("You say, \"" + text + "\"");
    }

    private void inventory(RequestContext context, LivingHandle living) {
        List<ObjectRecord> items = living.inventory();
        if (items.isEmpty()) {
            context.write("You are empty-handed.");
            return;
        }
        context.write("You carry: " + items.stream().map(ObjectRecord::name).collect(Collectors.joining(", ")) + ".");
    }

    @Override
    public String prompt(HandlerFrame frame) {
        return "> ";
    }
}
