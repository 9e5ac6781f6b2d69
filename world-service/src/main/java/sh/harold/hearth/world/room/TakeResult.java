package sh.harold.hearth.world.room;

/**
 * Answer of a room to a request to pick up an object.
 *
 * @param object the object that was taken or refused, {@code null} when absent
 */
public record TakeResult(Status status, ObjectRecord object) {

    public enum Status {
        TAKEN,
        ATTACHED,
        ABSENT
    }

    public static TakeResult taken(ObjectRecord object) {
        return new TakeResult(Status.TAKEN, object);
    }

    public static TakeResult attached(ObjectRecord object) {
        return new TakeResult(Status.ATTACHED, object);
    }

    public static TakeResult absent() {
        return new TakeResult(Status.ABSENT, null);
    }
}
