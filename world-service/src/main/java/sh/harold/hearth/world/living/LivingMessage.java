package sh.harold.hearth.world.living;

import org.apache.pekko.actor.typed.ActorRef;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.world.room.ObjectRecord;
import sh.harold.hearth.world.room.RoomId;

import java.util.List;

/**
 * Messages understood by a living actor.
 */
public sealed interface LivingMessage {

    record Look(ActorRef<String> replyTo) implements LivingMessage {
    }

    record Move(String direction, ActorRef<MoveOutcome> replyTo) implements LivingMessage {
    }

    record Take(String name, ActorRef<String> replyTo) implements LivingMessage {
    }

    record Drop(String name, ActorRef<String> replyTo) implements LivingMessage {
    }

    record Inventory(ActorRef<List<ObjectRecord>> replyTo) implements LivingMessage {
    }

    record Say(String text) implements LivingMessage {
    }

    record Where(ActorRef<RoomId> replyTo) implements LivingMessage {
    }

    /**
     * Something happened within sight of this living.
     */
    record Notify(String text) implements LivingMessage {
    }

    /**
     * Forced stop, recorded with the given reason.
     */
    record Stop(ExitReason reason) implements LivingMessage {
    }
}
