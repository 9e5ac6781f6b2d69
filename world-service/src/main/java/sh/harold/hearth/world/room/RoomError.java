package sh.harold.hearth.world.room;

/**
 * Why a room lookup or creation produced no room.
 */
public enum RoomError {
    /** No live room and no loadable definition. */
    NOT_FOUND,
    /** Creation was refused because the room is live or loadable. */
    ALREADY_EXISTS
}
