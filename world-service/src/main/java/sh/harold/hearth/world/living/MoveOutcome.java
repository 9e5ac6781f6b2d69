package sh.harold.hearth.world.living;

import sh.harold.hearth.world.room.RoomId;

/**
 * Result of a move attempt.
 *
 * @param destination the room moved into, {@code null} unless {@link Status#MOVED}
 * @param message     text to show the mover
 */
public record MoveOutcome(Status status, RoomId destination, String message) {

    public static final String NO_EXIT_MESSAGE = "You can't go that way.";
    public static final String NO_SUCH_ROOM_MESSAGE = "No such room.";

    public enum Status {
        MOVED,
        NO_EXIT,
        NO_SUCH_ROOM
    }

    public static MoveOutcome moved(RoomId destination, String view) {
        return new MoveOutcome(Status.MOVED, destination, view);
    }

    public static MoveOutcome noExit() {
        return new MoveOutcome(Status.NO_EXIT, null, NO_EXIT_MESSAGE);
    }

    public static MoveOutcome noSuchRoom() {
        return new MoveOutcome(Status.NO_SUCH_ROOM, null, NO_SUCH_ROOM_MESSAGE);
    }

    public boolean moved() {
        return status == Status.MOVED;
    }
}
