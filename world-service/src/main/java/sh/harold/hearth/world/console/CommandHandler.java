package sh.harold.hearth.world.console;

import java.io.PrintStream;

/**
 * An operator command typed at the server console.
 */
public interface CommandHandler {

    /**
     * @param args the command line split on whitespace, {@code args[0]} is the command name
     * @param out  where to print results
     * @return true if the command succeeded
     */
    boolean execute(String[] args, PrintStream out);

    String getName();

    default String[] getAliases() {
        return new String[0];
    }

    String getDescription();

    String getUsage();
}
