package sh.harold.hearth.world.session;

import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.PostStop;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.apache.pekko.actor.typed.javadsl.TimerScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.hearth.actor.ActorHandle;
import sh.harold.hearth.actor.ActorRuntime;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.actor.Lifeline;
import sh.harold.hearth.actor.SupervisionPolicy;
import sh.harold.hearth.world.WorldServices;
import sh.harold.hearth.world.config.UserFailurePolicy;
import sh.harold.hearth.world.net.ConnectionMessage;
import sh.harold.hearth.world.user.UserActor;
import sh.harold.hearth.world.user.UserHandle;
import sh.harold.hearth.world.user.UserMessage;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Conversation state of one connected player.
 *
 * <p>Input lines are queued and handed to the handler on top of the stack one at
 * a time, each inside its own request actor. The next line is not dispatched
 * before the previous request has exited, so replies keep the order of the input.
 * A request that runs past the configured timeout is stopped and the player is told.
 */
public final class SessionActor extends AbstractBehavior<SessionMessage> {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionActor.class);

    static final String BANNER = "Welcome to Hearth.";
    static final String TIMEOUT_MESSAGE = "That took too long, so it was cancelled.";
    static final String FAILURE_MESSAGE = "Something went wrong with that command.";
    static final String USER_LOST_MESSAGE = "Your character was lost. Please log in again.";
    static final String INPUT_DROPPED_MESSAGE = "You are typing faster than the world can keep up; that line was dropped.";
    static final int MAX_PENDING_LINES = 32;

    private static final Object WATCHDOG = "request-watchdog";

    private final Lifeline lifeline;
    private final ActorHandle<SessionMessage> self;
    private final TimerScheduler<SessionMessage> timers;
    private final ActorRef<ConnectionMessage> connection;
    private final WorldServices services;
    private final InputHandler loginHandler;
    private final SupervisionPolicy userPolicy;
    private final SessionLifecycle lifecycle;
    private final Deque<HandlerFrame> stack = new ArrayDeque<>();
    private final Deque<String> pending = new ArrayDeque<>();

    private ActorHandle<RequestActor.Command> currentRequest;
    private long requestCounter;
    private long usersStarted;
    private UserHandle user;

    private SessionActor(ActorContext<SessionMessage> context, TimerScheduler<SessionMessage> timers, Lifeline lifeline,
                         ActorRef<ConnectionMessage> connection, WorldServices services, InputHandler loginHandler) {
        super(context);
        this.lifeline = lifeline;
        this.self = ActorHandle.self(context, lifeline);
        this.timers = timers;
        this.connection = connection;
        this.services = services;
        this.loginHandler = loginHandler;
        this.userPolicy = services.config().userPolicy() == UserFailurePolicy.REAUTHENTICATE
                ? SupervisionPolicy.ABSORB
                : SupervisionPolicy.PROPAGATE;
        this.lifecycle = new SessionLifecycle(lifeline.name());
        stack.push(HandlerFrame.of(loginHandler));
        lifecycle.transitionTo(SessionPhase.AWAITING_AUTH, "connected");
        write(BANNER);
        prompt();
    }

    public static Behavior<SessionMessage> create(Lifeline lifeline, ActorRef<ConnectionMessage> connection,
                                                  WorldServices services, InputHandler loginHandler) {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(services, "services");
        Objects.requireNonNull(loginHandler, "loginHandler");
        return Behaviors.setup(context -> Behaviors.withTimers(timers ->
                new SessionActor(context, timers, lifeline, connection, services, loginHandler)));
    }

    @Override
    public Receive<SessionMessage> createReceive() {
        return newReceiveBuilder()
                .onMessage(SessionMessage.Input.class, this::onInput)
                .onMessage(SessionMessage.Output.class, output -> {
                    write(output.text());
                    return this;
                })
                .onMessage(SessionMessage.Push.class, push -> {
                    stack.push(push.frame());
                    return this;
                })
                .onMessage(SessionMessage.Pop.class, pop -> {
                    stack.poll();
                    return stack.isEmpty() ? stop(ExitReason.shutdown("handler stack empty")) : this;
                })
                .onMessage(SessionMessage.Replace.class, replace -> {
                    stack.poll();
                    stack.push(replace.frame());
                    return this;
                })
                .onMessage(SessionMessage.StartUser.class, start -> {
                    start.replyTo().tell(startUser(start));
                    return this;
                })
                .onMessage(SessionMessage.Logout.class, logout -> {
                    logout();
                    return this;
                })
                .onMessage(SessionMessage.Disconnect.class, disconnect -> {
                    if (disconnect.farewell() != null) {
                        write(disconnect.farewell());
                    }
                    connection.tell(new ConnectionMessage.Close("player quit"));
                    return this;
                })
                .onMessage(SessionMessage.GetPhase.class, query -> {
                    query.replyTo().tell(lifecycle.current());
                    return this;
                })
                .onMessage(SessionMessage.RequestTimedOut.class, this::onRequestTimedOut)
                .onMessage(SessionMessage.RequestExited.class, this::onRequestExited)
                .onMessage(SessionMessage.UserExited.class, this::onUserExited)
                .onSignal(PostStop.class, signal -> {
                    String reason = lifeline.exitReason().map(ExitReason::describe).orElse("stopped");
                    lifecycle.transitionTo(SessionPhase.TERMINATED, reason);
                    LOGGER.debug("Session stopped: {}", reason);
                    return this;
                })
                .build();
    }

    private Behavior<SessionMessage> onInput(SessionMessage.Input input) {
        if (pending.size() >= MAX_PENDING_LINES) {
            LOGGER.warn("Session {} has {} lines queued, dropping input", lifeline.name(), pending.size());
            write(INPUT_DROPPED_MESSAGE);
            return this;
        }
        pending.addLast(input.line());
        return dispatchNext();
    }

    private Behavior<SessionMessage> dispatchNext() {
        if (currentRequest != null || pending.isEmpty()) {
            return this;
        }
        HandlerFrame top = stack.peek();
        if (top == null) {
            return stop(ExitReason.shutdown("handler stack empty"));
        }
        String line = pending.pollFirst();
        long sequence = ++requestCounter;
        UserHandle currentUser = user;
        currentRequest = ActorRuntime.spawnChild(getContext(), lifeline, "request-" + sequence,
                RequestActor.Command.class,
                requestLifeline -> RequestActor.create(requestLifeline, top, line,
                        new RequestContext(self, services, top, currentUser, requestLifeline)));
        getContext().watchWith(currentRequest.ref(), new SessionMessage.RequestExited(sequence));
        timers.startSingleTimer(WATCHDOG, new SessionMessage.RequestTimedOut(sequence),
                services.config().requestTimeout());
        return this;
    }

    private Behavior<SessionMessage> onRequestTimedOut(SessionMessage.RequestTimedOut timedOut) {
        if (currentRequest == null || timedOut.sequence() != requestCounter) {
            return this;
        }
        Duration timeout = services.config().requestTimeout();
        if (currentRequest.lifeline().exit(ExitReason.timeout("request ran longer than " + timeout.toMillis() + "ms"))) {
            getContext().stop(currentRequest.ref());
        }
        return this;
    }

    private Behavior<SessionMessage> onRequestExited(SessionMessage.RequestExited exited) {
        if (currentRequest == null || exited.sequence() != requestCounter) {
            return this;
        }
        ExitReason reason = currentRequest.exitReason().orElse(ExitReason.normal());
        timers.cancel(WATCHDOG);
        currentRequest = null;
        switch (reason.kind()) {
            case NORMAL:
                break;
            case TIMEOUT:
                LOGGER.warn("Request cancelled: {}", reason.describe());
                write(TIMEOUT_MESSAGE);
                break;
            default:
                LOGGER.warn("Request failed: {}", reason.describe(), reason.cause());
                write(FAILURE_MESSAGE);
                break;
        }
        prompt();
        return dispatchNext();
    }

    private Optional<UserHandle> startUser(SessionMessage.StartUser start) {
        if (user != null && user.isAlive()) {
            return Optional.empty();
        }
        if (currentRequest == null || currentRequest.lifeline() != start.request() || !start.request().isAlive()) {
            LOGGER.info("Ignoring login of {} from a request that is no longer running", start.account().username());
            return Optional.empty();
        }
        String username = start.account().username();
        usersStarted++;
        ActorHandle<UserMessage> actor = ActorRuntime.spawnChild(getContext(), lifeline,
                "user:" + username + ":" + usersStarted, UserMessage.class,
                userLifeline -> UserActor.create(userLifeline, start.account(), getContext().getSelf(), services),
                ActorRuntime.blocking());
        user = new UserHandle(actor, username, services.config().callTimeout());
        getContext().watchWith(actor.ref(), new SessionMessage.UserExited(user));
        stack.poll();
        stack.push(start.game());
        lifecycle.transitionTo(SessionPhase.IN_GAME, "logged in as " + username);
        return Optional.of(user);
    }

    private void logout() {
        if (user == null) {
            return;
        }
        getContext().unwatch(user.ref());
        user.actor().tell(new UserMessage.Logout());
        user = null;
        backToLogin("logout");
    }

    private Behavior<SessionMessage> onUserExited(SessionMessage.UserExited exited) {
        if (!exited.user().equals(user)) {
            return this;
        }
        ExitReason reason = user.actor().exitReason().orElse(ExitReason.shutdown("stopped"));
        if (userPolicy.stopsWatcher(reason)) {
            return stop(ExitReason.linked(user.actor().name(), reason));
        }
        LOGGER.warn("User {} exited ({}), returning session to login", user.username(), reason.describe());
        user = null;
        write(USER_LOST_MESSAGE);
        backToLogin("user lost");
        if (currentRequest == null) {
            prompt();
        }
        return this;
    }

    private Behavior<SessionMessage> stop(ExitReason reason) {
        lifeline.exit(reason);
        return Behaviors.stopped();
    }

    private void backToLogin(String reason) {
        stack.clear();
        stack.push(HandlerFrame.of(loginHandler));
        lifecycle.transitionTo(SessionPhase.AWAITING_AUTH, reason);
    }

    private void write(String text) {
        connection.tell(new ConnectionMessage.Write(text, true));
    }

    private void prompt() {
        HandlerFrame top = stack.peek();
        if (top != null) {
            connection.tell(new ConnectionMessage.Write(top.prompt(), false));
        }
    }
}
