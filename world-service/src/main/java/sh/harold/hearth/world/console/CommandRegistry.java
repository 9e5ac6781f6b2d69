package sh.harold.hearth.world.console;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Looks up console commands by name or alias and runs them.
 */
public class CommandRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<String, CommandHandler> commands = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();
    private final Supplier<PrintStream> out;

    public CommandRegistry() {
        this(() -> System.out);
    }

    /**
     * @param out resolved on every command, so a stream swapped in later is honoured
     */
    public CommandRegistry(Supplier<PrintStream> out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public void registerCommand(CommandHandler handler) {
        String name = handler.getName().toLowerCase(Locale.ROOT);
        commands.put(name, handler);
        for (String alias : handler.getAliases()) {
            aliases.put(alias.toLowerCase(Locale.ROOT), name);
        }
        LOGGER.debug("Registered console command {} ({} aliases)", name, handler.getAliases().length);
    }

    /**
     * Runs one console line.
     *
     * @return true if a command ran and reported success
     */
    public boolean executeCommand(String input) {
        if (input == null || input.isBlank()) {
            return false;
        }
        PrintStream out = this.out.get();
        String[] parts = input.trim().split("\\s+");
        CommandHandler handler = getCommand(parts[0]);
        if (handler == null) {
            out.println("Unknown command: " + parts[0]);
            out.println("Type 'help' for available commands");
            return false;
        }
        try {
            return handler.execute(parts, out);
        } catch (RuntimeException e) {
            LOGGER.error("Console command {} failed", handler.getName(), e);
            out.println("Error executing command: " + e.getMessage());
            return false;
        }
    }

    public Collection<CommandHandler> getAllCommands() {
        List<CommandHandler> sorted = new ArrayList<>(commands.values());
        sorted.sort(Comparator.comparing(CommandHandler::getName));
        return sorted;
    }

    public CommandHandler getCommand(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        return commands.get(aliases.getOrDefault(key, key));
    }
}
