package sh.harold.hearth.world.user;

import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.PostStop;
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
import sh.harold.hearth.actor.SupervisionPolicy;
import sh.harold.hearth.world.WorldServices;
import sh.harold.hearth.world.config.LivingFailurePolicy;
import sh.harold.hearth.world.living.LivingActor;
import sh.harold.hearth.world.living.LivingHandle;
import sh.harold.hearth.world.living.LivingMessage;
import sh.harold.hearth.world.living.LivingOwner;
import sh.harold.hearth.world.room.RoomId;
import sh.harold.hearth.world.session.SessionMessage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * A logged-in player. Registers itself with the game registry on start and owns
 * the player's living, which dies with it.
 *
 * <p>With {@link LivingFailurePolicy#DISCONNECT} a crashing living takes this
 * user down. With {@link LivingFailurePolicy#RESPAWN} a fresh living is spawned
 * in the last room the old one reached, up to {@link #MAX_RESPAWNS} times per
 * {@link #RESPAWN_WINDOW}.
 */
public final class UserActor extends AbstractBehavior<UserMessage> {
    private static final Logger LOGGER = LoggerFactory.getLogger(UserActor.class);

    static final int MAX_RESPAWNS = 3;
    static final Duration RESPAWN_WINDOW = Duration.ofMinutes(1);

    private final Lifeline lifeline;
    private final UserAccount account;
    private final ActorRef<SessionMessage> session;
    private final WorldServices services;
    private final Clock clock;
    private final SupervisionPolicy livingPolicy;
    private final Deque<Instant> respawns = new ArrayDeque<>();

    private LivingHandle living;
    private int livingsSpawned;
    private RoomId lastRoom;

    private UserActor(ActorContext<UserMessage> context, Lifeline lifeline, UserAccount account,
                      ActorRef<SessionMessage> session, WorldServices services, Clock clock) {
        super(context);
        this.lifeline = lifeline;
        this.account = account;
        this.session = session;
        this.services = services;
        this.clock = clock;
        this.lastRoom = services.config().startRoom();
        this.livingPolicy = services.config().livingPolicy() == LivingFailurePolicy.RESPAWN
                ? SupervisionPolicy.ABSORB
                : SupervisionPolicy.PROPAGATE;
        if (!services.games().register(account.username(), ActorHandle.self(context, lifeline))) {
            throw new IllegalStateException(account.username() + " is already logged in");
        }
        spawnLiving();
    }

    /**
     * The user blocks on the registry and on its living, so spawn it with {@link ActorRuntime#blocking()}.
     */
    public static Behavior<UserMessage> create(Lifeline lifeline, UserAccount account,
                                               ActorRef<SessionMessage> session, WorldServices services) {
        return create(lifeline, account, session, services, Clock.systemUTC());
    }

    static Behavior<UserMessage> create(Lifeline lifeline, UserAccount account, ActorRef<SessionMessage> session,
                                        WorldServices services, Clock clock) {
        Objects.requireNonNull(account, "account");
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(services, "services");
        Objects.requireNonNull(clock, "clock");
        return Behaviors.setup(context -> new UserActor(context, lifeline, account, session, services, clock));
    }

    @Override
    public Receive<UserMessage> createReceive() {
        return newReceiveBuilder()
                .onMessage(UserMessage.Output.class, output -> {
                    session.tell(new SessionMessage.Output(output.text()));
                    return this;
                })
                .onMessage(UserMessage.LivingMoved.class, moved -> {
                    lastRoom = moved.room();
                    return this;
                })
                .onMessage(UserMessage.GetLiving.class, query -> {
                    query.replyTo().tell(living);
                    return this;
                })
                .onMessage(UserMessage.Logout.class, logout -> {
                    LOGGER.info("{} logged out", account.username());
                    return Behaviors.stopped();
                })
                .onMessage(UserMessage.Stop.class, stop -> {
                    lifeline.exit(stop.reason());
                    return Behaviors.stopped();
                })
                .onMessage(UserMessage.LivingExited.class, this::onLivingExited)
                .onSignal(PostStop.class, signal -> {
                    LOGGER.debug("User {} stopped: {}", account.username(),
                            lifeline.exitReason().map(ExitReason::describe).orElse("stopped"));
                    return this;
                })
                .build();
    }

    private Behavior<UserMessage> onLivingExited(UserMessage.LivingExited exited) {
        if (!exited.living().equals(living)) {
            return this;
        }
        ExitReason reason = exited.living().actor().exitReason().orElse(ExitReason.shutdown("stopped"));
        if (reason.isNormal()) {
            return this;
        }
        if (livingPolicy.stopsWatcher(reason)) {
            lifeline.exit(ExitReason.linked(living.actor().name(), reason));
            return Behaviors.stopped();
        }
        Instant now = clock.instant();
        while (!respawns.isEmpty() && respawns.peekFirst().isBefore(now.minus(RESPAWN_WINDOW))) {
            respawns.pollFirst();
        }
        if (respawns.size() >= MAX_RESPAWNS) {
            LOGGER.error("Living of {} keeps failing, giving up after {} respawns", account.username(), respawns.size());
            lifeline.exit(ExitReason.linked(living.actor().name(), reason));
            return Behaviors.stopped();
        }
        respawns.addLast(now);
        LOGGER.warn("Living of {} exited ({}), respawning in {}", account.username(), reason.describe(), lastRoom);
        session.tell(new SessionMessage.Output("The world shimmers and you find yourself whole again."));
        spawnLiving();
        return this;
    }

    private void spawnLiving() {
        ActorRef<UserMessage> self = getContext().getSelf();
        LivingOwner owner = new LivingOwner() {
            @Override
            public void show(String text) {
                self.tell(new UserMessage.Output(text));
            }

            @Override
            public void moved(RoomId room) {
                self.tell(new UserMessage.LivingMoved(room));
            }
        };
        Duration callTimeout = services.config().callTimeout();
        livingsSpawned++;
        ActorHandle<LivingMessage> actor = ActorRuntime.spawnChild(getContext(), lifeline,
                "living:" + account.username() + ":" + livingsSpawned, LivingMessage.class,
                livingLifeline -> LivingActor.create(livingLifeline, account.username(), services.rooms(),
                        lastRoom, services.config().startRoom(), owner, callTimeout),
                ActorRuntime.blocking());
        living = new LivingHandle(actor, account.username(), callTimeout);
        getContext().watchWith(actor.ref(), new UserMessage.LivingExited(living));
    }
}
