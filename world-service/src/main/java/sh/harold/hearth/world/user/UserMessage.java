package sh.harold.hearth.world.user;

import org.apache.pekko.actor.typed.ActorRef;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.world.living.LivingHandle;
import sh.harold.hearth.world.room.RoomId;

/**
 * Messages understood by a user actor.
 */
public sealed interface UserMessage {

    /**
     * Text for the player, forwarded to their session.
     */
    record Output(String text) implements UserMessage {
    }

    record LivingMoved(RoomId room) implements UserMessage {
    }

    record GetLiving(ActorRef<LivingHandle> replyTo) implements UserMessage {
    }

    /**
     * Ends the user normally, taking its living with it.
     */
    record Logout() implements UserMessage {
    }

    /**
     * Forced stop, recorded with the given reason.
     */
    record Stop(ExitReason reason) implements UserMessage {
    }

    /**
     * Death notice for the user's living.
     */
    record LivingExited(LivingHandle living) implements UserMessage {
    }
}
