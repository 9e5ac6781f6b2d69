package sh.harold.hearth.world.room;

import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.hearth.actor.ActorHandle;
import sh.harold.hearth.actor.ActorRuntime;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.actor.Lifeline;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Finds, loads and creates rooms.
 *
 * <p>Lookups first try the {@link RoomCacheIndex} from the calling thread. Only a
 * miss, or a hit on a dead room, goes to the coordinator actor, which serializes
 * every load and spawn. That keeps the hot path lock-free while guaranteeing that
 * at most one live room exists per id.
 *
 * <p>The coordinator is restarted on the next call if it ever dies. Rooms are spawned
 * at the top level rather than as its children, so they survive such a restart.
 */
public final class RoomManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(RoomManager.class);

    public static final String DEFAULT_TITLE = "A non-descript room";
    public static final String DEFAULT_BRIEF = "This is a rather boring room, someone should fix that.";
    static final String COORDINATOR_NAME = "room-manager";

    private final ActorRuntime runtime;
    private final RoomStore store;
    private final RoomCacheIndex index;
    private final Duration callTimeout;
    private final AtomicLong loadAttempts = new AtomicLong();
    private final AtomicLong roomsSpawned = new AtomicLong();
    private final Object coordinatorLock = new Object();
    private volatile ActorHandle<Request> coordinator;

    public RoomManager(ActorRuntime runtime, RoomStore store, Duration callTimeout) {
        this(runtime, store, new RoomCacheIndex(), callTimeout);
    }

    public RoomManager(ActorRuntime runtime, RoomStore store, RoomCacheIndex index, Duration callTimeout) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.store = Objects.requireNonNull(store, "store");
        this.index = Objects.requireNonNull(index, "index");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
    }

    /**
     * Returns the live room for {@code id}, loading it from the store when needed.
     *
     * @throws sh.harold.hearth.actor.ActorCallException if the coordinator does not answer in time
     */
    public RoomResult getRoom(RoomId id) {
        Objects.requireNonNull(id, "id");
        Optional<RoomHandle> cached = index.lookupLive(id);
        if (cached.isPresent()) {
            return RoomResult.found(cached.get());
        }
        return coordinator().call(replyTo -> new GetRoom(id, replyTo), callTimeout);
    }

    /**
     * Creates an empty room named {@code id}. Refused with
     * {@link RoomError#ALREADY_EXISTS} when the room is live or has a definition.
     */
    public RoomResult newRoom(RoomId id) {
        Objects.requireNonNull(id, "id");
        if (index.lookupLive(id).isPresent()) {
            return RoomResult.alreadyExists();
        }
        return coordinator().call(replyTo -> new NewRoom(id, replyTo), callTimeout);
    }

    public RoomCacheIndex index() {
        return index;
    }

    public long loadAttempts() {
        return loadAttempts.get();
    }

    public long roomsSpawned() {
        return roomsSpawned.get();
    }

    ActorHandle<Request> coordinator() {
        ActorHandle<Request> current = coordinator;
        if (current != null && current.isAlive()) {
            return current;
        }
        synchronized (coordinatorLock) {
            current = coordinator;
            if (current == null || !current.isAlive()) {
                if (current != null) {
                    LOGGER.warn("Room coordinator exited ({}), starting a new one",
                            current.exitReason().map(ExitReason::describe).orElse("unknown"));
                }
                current = runtime.spawn(COORDINATOR_NAME, Request.class,
                        lifeline -> Behaviors.setup(context -> new Coordinator(context, lifeline)),
                        ActorRuntime.blocking());
                coordinator = current;
            }
            return current;
        }
    }

    sealed interface Request permits GetRoom, NewRoom, StopCoordinator {
    }

    record GetRoom(RoomId id, ActorRef<RoomResult> replyTo) implements Request {
    }

    record NewRoom(RoomId id, ActorRef<RoomResult> replyTo) implements Request {
    }

    record StopCoordinator(ExitReason reason) implements Request {
    }

    /**
     * Serializes loads and spawns. It blocks on the store and on spawning, so it runs on the
     * blocking dispatcher.
     */
    private final class Coordinator extends AbstractBehavior<Request> {
        private final Lifeline lifeline;

        private Coordinator(ActorContext<Request> context, Lifeline lifeline) {
            super(context);
            this.lifeline = lifeline;
        }

        @Override
        public Receive<Request> createReceive() {
            return newReceiveBuilder()
                    .onMessage(GetRoom.class, get -> {
                        get.replyTo().tell(getOrLoad(get.id()));
                        return this;
                    })
                    .onMessage(NewRoom.class, create -> {
                        create.replyTo().tell(create(create.id()));
                        return this;
                    })
                    .onMessage(StopCoordinator.class, stop -> {
                        lifeline.exit(stop.reason());
                        return Behaviors.<Request>stopped();
                    })
                    .build();
        }
        private RoomResult getOrLoad(RoomId id) {
            // Re-check: an earlier request in the queue may have loaded it already.
            Optional<RoomHandle> live = index.lookupLive(id);
            if (live.isPresent()) {
                return RoomResult.found(live.get());
            }
            return load(id);
        }

        private RoomResult create(RoomId id) {
            if (index.lookupLive(id).isPresent()) {
                return RoomResult.alreadyExists();
            }
            if (load(id).isFound()) {
                return RoomResult.alreadyExists();
            }
            RoomHandle handle = spawn(RoomRecord.blank(id, DEFAULT_TITLE, DEFAULT_BRIEF));
            LOGGER.info("Created room {}", id);
            return RoomResult.found(handle);
        }

        private RoomResult load(RoomId id) {
            loadAttempts.incrementAndGet();
            Optional<RoomRecord> record;
            try {
                record = store.load(id);
            } catch (RuntimeException e) {
                LOGGER.warn("Room store failed while loading {}", id, e);
                record = Optional.empty();
            }
            if (record.isEmpty()) {
                return RoomResult.notFound();
            }
            boolean reload = index.lookup(id).isPresent();
            RoomHandle handle = spawn(record.get());
            if (reload) {
                LOGGER.info("Reloaded room {} after its previous instance exited", id);
            } else {
                LOGGER.info("Loaded room {}", id);
            }
            return RoomResult.found(handle);
        }

        private RoomHandle spawn(RoomRecord record) {
            ActorHandle<RoomMessage> room = runtime.spawn("room:" + record.id(), RoomMessage.class,
                    lifeline -> RoomActor.create(record, lifeline));
            RoomHandle handle = new RoomHandle(record.id(), room, callTimeout);
            index.put(handle);
            roomsSpawned.incrementAndGet();
            return handle;
        }
    }
}
