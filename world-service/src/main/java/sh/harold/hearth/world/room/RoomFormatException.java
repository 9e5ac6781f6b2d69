package sh.harold.hearth.world.room;

/**
 * A room file exists but does not describe a valid room.
 */
public class RoomFormatException extends Exception {

    public RoomFormatException(String message) {
        super(message);
    }
}
