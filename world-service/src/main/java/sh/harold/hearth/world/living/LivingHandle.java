package sh.harold.hearth.world.living;

import org.apache.pekko.actor.typed.ActorRef;
import sh.harold.hearth.actor.ActorHandle;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.world.room.ObjectRecord;
import sh.harold.hearth.world.room.RoomId;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Typed front for a living actor, carrying the name rooms show for it.
 */
public record LivingHandle(ActorHandle<LivingMessage> actor, String name, Duration callTimeout) {

    public LivingHandle {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(callTimeout, "callTimeout");
    }

    public ActorRef<LivingMessage> ref() {
        return actor.ref();
    }

    public boolean isAlive() {
        return actor.isAlive();
    }

    public void stop(ExitReason reason) {
        actor.tell(new LivingMessage.Stop(reason));
    }

    public String look() {
        return actor.call(LivingMessage.Look::new, callTimeout);
    }

    public MoveOutcome move(String direction) {
        return actor.call(replyTo -> new LivingMessage.Move(direction, replyTo), callTimeout);
    }

    public String take(String name) {
        return actor.call(replyTo -> new LivingMessage.Take(name, replyTo), callTimeout);
    }

    public String drop(String name) {
        return actor.call(replyTo -> new LivingMessage.Drop(name, replyTo), callTimeout);
    }

    public List<ObjectRecord> inventory() {
        return actor.call(LivingMessage.Inventory::new, callTimeout);
    }

    public void say(String text) {
        actor.tell(new LivingMessage.Say(text));
    }

    public RoomId where() {
        return actor.call(LivingMessage.Where::new, callTimeout);
    }

    public void show(String text) {
        actor.tell(new LivingMessage.Notify(text));
    }
}
