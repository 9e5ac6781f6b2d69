package sh.harold.hearth.world.room;

import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.PostStop;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.actor.Lifeline;
import sh.harold.hearth.world.living.LivingHandle;
import sh.harold.hearth.world.living.LivingMessage;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the state of one room. Occupants are watched without fate-sharing: a
 * crashing occupant is simply removed, and a crashing room leaves its occupants
 * running.
 *
 * <p>Rooms never block, so they run on the default dispatcher.
 */
public final class RoomActor extends AbstractBehavior<RoomMessage> {
    private static final Logger LOGGER = LoggerFactory.getLogger(RoomActor.class);

    private final Lifeline lifeline;
    private final RoomId id;
    private final String title;
    private final String brief;
    private String longDescription;
    private final Map<String, RoomId> exits;
    private final List<ObjectRecord> objects;
    private final List<ResetSpec> resets;
    private final Map<ActorRef<LivingMessage>, LivingHandle> occupants = new LinkedHashMap<>();

    private RoomActor(ActorContext<RoomMessage> context, Lifeline lifeline, RoomRecord record) {
        super(context);
        this.lifeline = lifeline;
        this.id = record.id();
        this.title = record.title();
        this.brief = record.brief();
        this.longDescription = record.longDescription();
        this.exits = new LinkedHashMap<>();
        record.exits().forEach((direction, destination) -> exits.put(normalize(direction), destination));
        this.objects = new ArrayList<>(record.objects());
        this.resets = new ArrayList<>(record.resets());
        LOGGER.debug("Room {} started with {} exits and {} objects", id, exits.size(), objects.size());
    }

    public static Behavior<RoomMessage> create(RoomRecord record, Lifeline lifeline) {
        return Behaviors.setup(context -> new RoomActor(context, lifeline, record));
    }

    @Override
    public Receive<RoomMessage> createReceive() {
        return newReceiveBuilder()
                .onMessage(RoomMessage.Enter.class, enter -> {
                    enter.replyTo().tell(enter(enter.living()));
                    return this;
                })
                .onMessage(RoomMessage.Leave.class, leave -> {
                    leave.replyTo().tell(leave(leave.living(), leave.direction()));
                    return this;
                })
                .onMessage(RoomMessage.Describe.class, describe -> {
                    describe.replyTo().tell(view());
                    return this;
                })
                .onMessage(RoomMessage.ExitTo.class, exitTo -> {
                    exitTo.replyTo().tell(Optional.ofNullable(exits.get(normalize(exitTo.direction()))));
                    return this;
                })
                .onMessage(RoomMessage.TakeObject.class, take -> {
                    take.replyTo().tell(take(take.taker(), take.name()));
                    return this;
                })
                .onMessage(RoomMessage.PutObject.class, this::onPutObject)
                .onMessage(RoomMessage.Say.class, say -> {
                    announce(say.speaker().ref(), say.speaker().name() + " says, \"" + say.text() + "\"");
                    return this;
                })
                .onMessage(RoomMessage.Occupants.class, query -> {
                    query.replyTo().tell(occupantNames());
                    return this;
                })
                .onMessage(RoomMessage.GetName.class, query -> {
                    query.replyTo().tell(title);
                    return this;
                })
                .onMessage(RoomMessage.AddExit.class, addExit -> {
                    exits.put(normalize(addExit.direction()), addExit.destination());
                    return this;
                })
                .onMessage(RoomMessage.AddObject.class, addObject -> {
                    objects.add(addObject.object());
                    return this;
                })
                .onMessage(RoomMessage.AddReset.class, addReset -> {
                    resets.add(addReset.reset());
                    return this;
                })
                .onMessage(RoomMessage.SetLong.class, setLong -> {
                    longDescription = setLong.text();
                    return this;
                })
                .onMessage(RoomMessage.OccupantExited.class, this::onOccupantExited)
                .onMessage(RoomMessage.Stop.class, stop -> {
                    lifeline.exit(stop.reason());
                    return Behaviors.stopped();
                })
                .onSignal(PostStop.class, signal -> {
                    LOGGER.debug("Room {} stopped: {}", id, lifeline.exitReason().map(ExitReason::describe).orElse("stopped"));
                    return this;
                })
                .build();
    }

    private Behavior<RoomMessage> onPutObject(RoomMessage.PutObject put) {
        objects.add(put.object());
        if (put.dropper() != null) {
            announce(put.dropper().ref(), put.dropper().name() + " drops the " + put.object().name() + ".");
        }
        return this;
    }

    private Behavior<RoomMessage> onOccupantExited(RoomMessage.OccupantExited exited) {
        LivingHandle removed = occupants.remove(exited.living().ref());
        if (removed == null) {
            return this;
        }
        ExitReason reason = removed.actor().exitReason().orElse(ExitReason.shutdown("stopped"));
        if (reason.kind() == ExitReason.Kind.CRASHED) {
            LOGGER.warn("Room {} dropped occupant {} after it exited: {}", id, removed.name(), reason.describe());
        } else {
            LOGGER.debug("Room {} dropped occupant {}: {}", id, removed.name(), reason.describe());
        }
        announce(null, removed.name() + " fades from view.");
        return this;
    }

    private RoomView enter(LivingHandle living) {
        if (occupants.put(living.ref(), living) == null) {
            getContext().watchWith(living.ref(), new RoomMessage.OccupantExited(living));
            announce(living.ref(), living.name() + " arrives.");
        }
        return view();
    }

    private boolean leave(LivingHandle living, String direction) {
        if (occupants.remove(living.ref()) == null) {
            return false;
        }
        getContext().unwatch(living.ref());
        if (direction == null) {
            announce(null, living.name() + " leaves.");
        } else {
            announce(null, living.name() + " leaves " + direction + ".");
        }
        return true;
    }

    private TakeResult take(LivingHandle taker, String name) {
        Iterator<ObjectRecord> iterator = objects.iterator();
        while (iterator.hasNext()) {
            ObjectRecord object = iterator.next();
            if (!object.matches(name)) {
                continue;
            }
            if (object.attached()) {
                return TakeResult.attached(object);
            }
            iterator.remove();
            if (taker != null) {
                announce(taker.ref(), taker.name() + " takes the " + object.name() + ".");
            }
            return TakeResult.taken(object);
        }
        return TakeResult.absent();
    }

    private RoomView view() {
        return new RoomView(id, title, brief, longDescription, exits, objects, occupantNames());
    }

    private List<String> occupantNames() {
        List<String> names = new ArrayList<>(occupants.size());
        for (LivingHandle living : occupants.values()) {
            names.add(living.name());
        }
        return names;
    }

    private void announce(ActorRef<LivingMessage> except, String text) {
        for (ActorRef<LivingMessage> occupant : occupants.keySet()) {
            if (!occupant.equals(except)) {
                occupant.tell(new LivingMessage.Notify(text));
            }
        }
    }

    static String normalize(String direction) {
        return direction == null ? "" : direction.trim().toLowerCase(Locale.ROOT);
    }
}
