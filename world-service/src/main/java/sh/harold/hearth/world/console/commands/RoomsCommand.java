package sh.harold.hearth.world.console.commands;

import sh.harold.hearth.world.console.CommandHandler;
import sh.harold.hearth.world.console.TableFormatter;
import sh.harold.hearth.world.room.RoomHandle;
import sh.harold.hearth.world.room.RoomManager;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Shows the room cache: every room ever spawned and whether it is still running.
 */
public record RoomsCommand(RoomManager rooms) implements CommandHandler {

    public RoomsCommand {
        Objects.requireNonNull(rooms, "rooms");
    }

    @Override
    public boolean execute(String[] args, PrintStream out) {
        List<RoomHandle> handles = rooms.index().snapshot();
        if (handles.isEmpty()) {
            out.println("No rooms loaded yet.");
            return true;
        }
        TableFormatter table = new TableFormatter().addHeaders("Room", "Actor", "State");
        for (RoomHandle handle : handles) {
            table.addRow(handle.id().value(), handle.actor().path(),
                    handle.isAlive() ? "live" : "dead");
        }
        out.println(table.build());
        out.println(TableFormatter.bold("Load attempts: ") + rooms.loadAttempts()
                + TableFormatter.bold(", rooms spawned: ") + rooms.roomsSpawned());
        return true;
    }

    @Override
    public String getName() {
        return "rooms";
    }

    @Override
    public String getDescription() {
        return "List cached rooms";
    }

    @Override
    public String getUsage() {
        return "rooms";
    }
}
