package sh.harold.hearth.world.living;

import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.PostStop;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.hearth.actor.ActorHandle;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.actor.Lifeline;
import sh.harold.hearth.world.room.ObjectRecord;
import sh.harold.hearth.world.room.RoomHandle;
import sh.harold.hearth.world.room.RoomId;
import sh.harold.hearth.world.room.RoomManager;
import sh.harold.hearth.world.room.RoomResult;
import sh.harold.hearth.world.room.TakeResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An in-world body. Tracks its room and inventory and talks to rooms on its owner's behalf.
 *
 * <p>If the room it stands in has died, the room is fetched again from the
 * {@link RoomManager} and re-entered before the next action. Every action blocks on a
 * room, so livings belong on the blocking dispatcher.
 */
public final class LivingActor extends AbstractBehavior<LivingMessage> {
    private static final Logger LOGGER = LoggerFactory.getLogger(LivingActor.class);

    private final Lifeline lifeline;
    private final String name;
    private final RoomManager rooms;
    private final RoomId fallbackRoom;
    private final LivingOwner owner;
    private final List<ObjectRecord> inventory = new ArrayList<>();
    private final LivingHandle self;

    private RoomId currentRoomId;
    private RoomHandle currentRoom;

    private LivingActor(ActorContext<LivingMessage> context, Lifeline lifeline, String name, RoomManager rooms,
                        RoomId startRoom, RoomId fallbackRoom, LivingOwner owner, Duration callTimeout) {
        super(context);
        this.lifeline = lifeline;
        this.name = name;
        this.rooms = rooms;
        this.fallbackRoom = fallbackRoom;
        this.owner = owner;
        this.self = new LivingHandle(ActorHandle.self(context, lifeline), name, callTimeout);
        placeIn(startRoom);
        LOGGER.debug("{} appeared in {}", name, currentRoomId);
    }

    public static Behavior<LivingMessage> create(Lifeline lifeline, String name, RoomManager rooms, RoomId startRoom,
                                                 LivingOwner owner, Duration callTimeout) {
        return create(lifeline, name, rooms, startRoom, startRoom, owner, callTimeout);
    }

    /**
     * @param fallbackRoom where to go when {@code startRoom} cannot be found
     */
    public static Behavior<LivingMessage> create(Lifeline lifeline, String name, RoomManager rooms, RoomId startRoom,
                                                 RoomId fallbackRoom, LivingOwner owner, Duration callTimeout) {
        Objects.requireNonNull(lifeline, "lifeline");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rooms, "rooms");
        Objects.requireNonNull(startRoom, "startRoom");
        Objects.requireNonNull(fallbackRoom, "fallbackRoom");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(callTimeout, "callTimeout");
        return Behaviors.setup(context ->
                new LivingActor(context, lifeline, name, rooms, startRoom, fallbackRoom, owner, callTimeout));
    }

    @Override
    public Receive<LivingMessage> createReceive() {
        return newReceiveBuilder()
                .onMessage(LivingMessage.Notify.class, notify -> {
                    owner.show(notify.text());
                    return this;
                })
                .onMessage(LivingMessage.Look.class, look -> {
                    look.replyTo().tell(room().describe().render(name));
                    return this;
                })
                .onMessage(LivingMessage.Move.class, move -> {
                    move.replyTo().tell(move(move.direction()));
                    return this;
                })
                .onMessage(LivingMessage.Take.class, take -> {
                    take.replyTo().tell(take(take.name()));
                    return this;
                })
                .onMessage(LivingMessage.Drop.class, drop -> {
                    drop.replyTo().tell(drop(drop.name()));
                    return this;
                })
                .onMessage(LivingMessage.Inventory.class, query -> {
                    query.replyTo().tell(List.copyOf(inventory));
                    return this;
                })
                .onMessage(LivingMessage.Say.class, say -> {
                    room().say(self, say.text());
                    return this;
                })
                .onMessage(LivingMessage.Where.class, query -> {
                    query.replyTo().tell(currentRoomId);
                    return this;
                })
                .onMessage(LivingMessage.Stop.class, stop -> {
                    lifeline.exit(stop.reason());
                    return Behaviors.stopped();
                })
                .onSignal(PostStop.class, signal -> {
                    LOGGER.debug("{} left the world: {}", name, lifeline.exitReason().map(ExitReason::describe).orElse("stopped"));
                    return this;
                })
                .build();
    }

    private MoveOutcome move(String direction) {
        RoomHandle here = room();
        Optional<RoomId> destination = here.exitTo(direction);
        if (destination.isEmpty()) {
            return MoveOutcome.noExit();
        }
        RoomResult result = rooms.getRoom(destination.get());
        if (!(result instanceof RoomResult.Found found)) {
            LOGGER.debug("{} tried to go {} from {} into missing room {}", name, direction, currentRoomId, destination.get());
            return MoveOutcome.noSuchRoom();
        }
        here.leave(self, direction);
        RoomHandle target = found.room();
        String view = target.enter(self).render(name);
        currentRoom = target;
        currentRoomId = target.id();
        owner.moved(currentRoomId);
        return MoveOutcome.moved(currentRoomId, view);
    }

    private String take(String objectName) {
        TakeResult result = room().takeObject(self, objectName);
        switch (result.status()) {
            case TAKEN:
                inventory.add(result.object());
                return "You take the " + result.object().name() + ".";
            case ATTACHED:
                return "The " + result.object().name() + " won't budge.";
            default:
                return "There is no " + objectName + " here.";
        }
    }

    private String drop(String objectName) {
        Iterator<ObjectRecord> iterator = inventory.iterator();
        while (iterator.hasNext()) {
            ObjectRecord object = iterator.next();
            if (object.matches(objectName)) {
                iterator.remove();
                room().putObject(self, object);
                return "You drop the " + object.name() + ".";
            }
        }
        return "You aren't carrying any " + objectName + ".";
    }

    private RoomHandle room() {
        if (currentRoom != null && currentRoom.isAlive()) {
            return currentRoom;
        }
        LOGGER.info("Room {} under {} went away, re-entering", currentRoomId, name);
        placeIn(currentRoomId);
        return currentRoom;
    }

    private void placeIn(RoomId preferred) {
        RoomResult result = rooms.getRoom(preferred);
        if (!result.isFound() && !preferred.equals(fallbackRoom)) {
            LOGGER.warn("Room {} is unavailable for {}, using {}", preferred, name, fallbackRoom);
            result = rooms.getRoom(fallbackRoom);
        }
        RoomHandle room = result.handle()
                .orElseThrow(() -> new IllegalStateException("No room available for " + name));
        room.enter(self);
        currentRoom = room;
        currentRoomId = room.id();
        owner.moved(currentRoomId);
    }
}
