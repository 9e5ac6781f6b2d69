package sh.harold.hearth.world.living;

import sh.harold.hearth.world.room.RoomId;

/**
 * Receives what a living perceives and where it ends up.
 */
@FunctionalInterface
public interface LivingOwner {

    void show(String text);

    default void moved(RoomId room) {
    }
}
