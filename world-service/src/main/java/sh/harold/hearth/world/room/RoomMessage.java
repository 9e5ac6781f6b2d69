package sh.harold.hearth.world.room;

import org.apache.pekko.actor.typed.ActorRef;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.world.living.LivingHandle;

import java.util.List;
import java.util.Optional;

/**
 * Messages understood by a room actor.
 */
public sealed interface RoomMessage {

    record AddExit(String direction, RoomId destination) implements RoomMessage {
    }

    record AddObject(ObjectRecord object) implements RoomMessage {
    }

    record AddReset(ResetSpec reset) implements RoomMessage {
    }

    /**
     * @param text replacement long description, {@code null} clears it
     */
    record SetLong(String text) implements RoomMessage {
    }

    record Enter(LivingHandle living, ActorRef<RoomView> replyTo) implements RoomMessage {
    }

    /**
     * @param direction where the living is heading, {@code null} when unknown
     */
    record Leave(LivingHandle living, String direction, ActorRef<Boolean> replyTo) implements RoomMessage {
    }

    record GetName(ActorRef<String> replyTo) implements RoomMessage {
    }

    record Describe(ActorRef<RoomView> replyTo) implements RoomMessage {
    }

    record ExitTo(String direction, ActorRef<Optional<RoomId>> replyTo) implements RoomMessage {
    }

    record TakeObject(LivingHandle taker, String name, ActorRef<TakeResult> replyTo) implements RoomMessage {
    }

    /**
     * @param dropper who put it down, {@code null} for objects placed by the world
     */
    record PutObject(LivingHandle dropper, ObjectRecord object) implements RoomMessage {
    }

    record Say(LivingHandle speaker, String text) implements RoomMessage {
    }

    record Occupants(ActorRef<List<String>> replyTo) implements RoomMessage {
    }

    /**
     * Forced stop, recorded with the given reason.
     */
    record Stop(ExitReason reason) implements RoomMessage {
    }

    /**
     * Death notice for a watched occupant.
     */
    record OccupantExited(LivingHandle living) implements RoomMessage {
    }
}
