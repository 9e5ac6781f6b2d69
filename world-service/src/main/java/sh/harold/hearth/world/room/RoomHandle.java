package sh.harold.hearth.world.room;

import sh.harold.hearth.actor.ActorHandle;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.world.living.LivingHandle;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed front for a room actor. Request methods block for at most the configured
 * call timeout and throw {@link sh.harold.hearth.actor.ActorCallException} when the
 * room does not answer in time or is gone.
 */
public final class RoomHandle {

    private final RoomId id;
    private final ActorHandle<RoomMessage> actor;
    private final Duration callTimeout;

    public RoomHandle(RoomId id, ActorHandle<RoomMessage> actor, Duration callTimeout) {
        this.id = Objects.requireNonNull(id, "id");
        this.actor = Objects.requireNonNull(actor, "actor");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
    }

    public RoomId id() {
        return id;
    }

    public ActorHandle<RoomMessage> actor() {
        return actor;
    }

    public boolean isAlive() {
        return actor.isAlive();
    }

    public void stop(ExitReason reason) {
        actor.tell(new RoomMessage.Stop(reason));
    }

    public void addExit(String direction, RoomId destination) {
        actor.tell(new RoomMessage.AddExit(direction, destination));
    }

    public void addObject(ObjectRecord object) {
        actor.tell(new RoomMessage.AddObject(object));
    }

    public void addReset(ResetSpec reset) {
        actor.tell(new RoomMessage.AddReset(reset));
    }

    public void setLong(String text) {
        actor.tell(new RoomMessage.SetLong(text));
    }

    public RoomView enter(LivingHandle living) {
        return actor.call(replyTo -> new RoomMessage.Enter(living, replyTo), callTimeout);
    }

    public boolean leave(LivingHandle living, String direction) {
        return actor.call(replyTo -> new RoomMessage.Leave(living, direction, replyTo), callTimeout);
    }

    public String getName() {
        return actor.call(RoomMessage.GetName::new, callTimeout);
    }

    public RoomView describe() {
        return actor.call(RoomMessage.Describe::new, callTimeout);
    }

    public Optional<RoomId> exitTo(String direction) {
        return actor.call(replyTo -> new RoomMessage.ExitTo(direction, replyTo), callTimeout);
    }

    public TakeResult takeObject(LivingHandle taker, String name) {
        return actor.call(replyTo -> new RoomMessage.TakeObject(taker, name, replyTo), callTimeout);
    }

    public void putObject(LivingHandle dropper, ObjectRecord object) {
        actor.tell(new RoomMessage.PutObject(dropper, object));
    }

    public void say(LivingHandle speaker, String text) {
        actor.tell(new RoomMessage.Say(speaker, text));
    }

    public List<String> occupants() {
        return actor.call(RoomMessage.Occupants::new, callTimeout);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoomHandle other)) return false;
        return actor.equals(other.actor);
    }

    @Override
    public int hashCode() {
        return actor.hashCode();
    }

    @Override
    public String toString() {
        return "RoomHandle{" + id + ", " + actor.name() + (actor.isAlive() ? "" : ", dead") + "}";
    }
}
