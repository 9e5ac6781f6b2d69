package sh.harold.hearth.world.console.commands;

import sh.harold.hearth.world.console.CommandHandler;
import sh.harold.hearth.world.console.CommandRegistry;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Lists console commands, or details one of them.
 */
public record HelpCommand(CommandRegistry registry) implements CommandHandler {

    public HelpCommand {
        Objects.requireNonNull(registry, "registry");
    }

    @Override
    public boolean execute(String[] args, PrintStream out) {
        if (args.length > 1) {
            CommandHandler handler = registry.getCommand(args[1]);
            if (handler == null) {
                out.println("Unknown command: " + args[1]);
                return false;
            }
            out.println("Command: " + handler.getName());
            out.println("Description: " + handler.getDescription());
            out.println("Usage: " + handler.getUsage());
            if (handler.getAliases().length > 0) {
                out.println("Aliases: " + String.join(", ", handler.getAliases()));
            }
            return true;
        }

        out.println("Available commands:");
        for (CommandHandler handler : registry.getAllCommands()) {
            String aliases = handler.getAliases().length > 0
                    ? " [" + String.join(", ", handler.getAliases()) + "]"
                    : "";
            out.printf("  %-10s %s%s%n", handler.getName(), handler.getDescription(), aliases);
        }
        out.println("Type 'help <command>' for details.");
        return true;
    }

    @Override
    public String getName() {
        return "help";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"?", "h"};
    }

    @Override
    public String getDescription() {
        return "Show available commands";
    }

    @Override
    public String getUsage() {
        return "help [command]";
    }
}
