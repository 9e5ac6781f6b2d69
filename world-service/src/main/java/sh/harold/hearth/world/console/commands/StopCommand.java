package sh.harold.hearth.world.console.commands;

import sh.harold.hearth.world.WorldService;
import sh.harold.hearth.world.console.CommandHandler;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Shuts the world down gracefully.
 */
public record StopCommand(WorldService worldService) implements CommandHandler {

    public StopCommand {
        Objects.requireNonNull(worldService, "worldService");
    }

    @Override
    public boolean execute(String[] args, PrintStream out) {
        out.println("Shutting down the world...");
        Thread stopper = new Thread(worldService::shutdown, "World-Stop");
        stopper.start();
        return true;
    }

    @Override
    public String getName() {
        return "stop";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"shutdown", "exit"};
    }

    @Override
    public String getDescription() {
        return "Disconnect everyone and stop the server";
    }

    @Override
    public String getUsage() {
        return "stop";
    }
}
