package sh.harold.hearth.world.console.commands;

import org.fusesource.jansi.Ansi;
import sh.harold.hearth.world.WorldService;
import sh.harold.hearth.world.console.CommandHandler;
import sh.harold.hearth.world.console.TableFormatter;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Toggles debug logging at runtime.
 */
public record DebugCommand(WorldService worldService) implements CommandHandler {

    public DebugCommand {
        Objects.requireNonNull(worldService, "worldService");
    }

    @Override
    public boolean execute(String[] args, PrintStream out) {
        boolean enabled = worldService.toggleDebugMode();
        out.println("Debug mode: " + (enabled
                ? TableFormatter.color("ENABLED", Ansi.Color.GREEN)
                : TableFormatter.color("DISABLED", Ansi.Color.RED)));
        return true;
    }

    @Override
    public String getName() {
        return "debug";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"verbose"};
    }

    @Override
    public String getDescription() {
        return "Toggle debug logging";
    }

    @Override
    public String getUsage() {
        return "debug";
    }
}
