package sh.harold.hearth.world.console.commands;

import sh.harold.hearth.world.console.CommandHandler;
import sh.harold.hearth.world.game.GameRegistry;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * Sends a message to every player online.
 */
public record WallCommand(GameRegistry games) implements CommandHandler {

    public WallCommand {
        Objects.requireNonNull(games, "games");
    }

    @Override
    public boolean execute(String[] args, PrintStream out) {
        if (args.length < 2) {
            out.println("Usage: " + getUsage());
            return false;
        }
        String text = String.join(" ", Arrays.copyOfRange(args, 1, args.length));
        games.broadcast("[Announcement] " + text);
        out.println("Sent to " + games.onlineUsers().size() + " players.");
        return true;
    }

    @Override
    public String getName() {
        return "wall";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"broadcast"};
    }

    @Override
    public String getDescription() {
        return "Broadcast a message to all players";
    }

    @Override
    public String getUsage() {
        return "wall <message>";
    }
}
