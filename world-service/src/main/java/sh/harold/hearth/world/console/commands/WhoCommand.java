package sh.harold.hearth.world.console.commands;

import sh.harold.hearth.world.console.CommandHandler;
import sh.harold.hearth.world.game.GameRegistry;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Lists the players currently in the game.
 */
public record WhoCommand(GameRegistry games) implements CommandHandler {

    public WhoCommand {
        Objects.requireNonNull(games, "games");
    }

    @Override
    public boolean execute(String[] args, PrintStream out) {
        List<String> online = games.onlineUsers();
        if (online.isEmpty()) {
            out.println("Nobody is online.");
            return true;
        }
        out.println(online.size() + " online: " + String.join(", ", online));
        return true;
    }

    @Override
    public String getName() {
        return "who";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"players", "online"};
    }

    @Override
    public String getDescription() {
        return "List players online";
    }

    @Override
    public String getUsage() {
        return "who";
    }
}
