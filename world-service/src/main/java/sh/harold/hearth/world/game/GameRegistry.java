package sh.harold.hearth.world.game;

import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.hearth.actor.ActorHandle;
import sh.harold.hearth.actor.ActorRuntime;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.world.user.UserMessage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Table of logged-in users, owned by a single actor.
 *
 * <p>The registry watches every registered user without sharing its fate, so a
 * crashing user is dropped from the table while the registry keeps running.
 */
public final class GameRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(GameRegistry.class);

    private final ActorHandle<Request> registrar;
    private final Duration callTimeout;

    public GameRegistry(ActorRuntime runtime, Duration callTimeout) {
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
        this.registrar = runtime.spawn("game-registry", Request.class,
                lifeline -> Behaviors.setup(Registrar::new));
    }

    /**
     * @return false when another live user holds the name
     */
    public boolean register(String username, ActorHandle<UserMessage> user) {
        return registrar.call(replyTo -> new Register(username, user, replyTo), callTimeout);
    }

    public Optional<ActorHandle<UserMessage>> lookup(String username) {
        return registrar.call(replyTo -> new Lookup(username, replyTo), callTimeout);
    }

    public boolean isOnline(String username) {
        return lookup(username).isPresent();
    }

    /**
     * @return display names of everyone online, sorted case-insensitively
     */
    public List<String> onlineUsers() {
        return registrar.call(Online::new, callTimeout);
    }

    public void broadcast(String text) {
        registrar.tell(new Broadcast(text));
    }

    public ActorHandle<?> registrar() {
        return registrar;
    }

    sealed interface Request permits Register, Lookup, Online, Broadcast, UserExited {
    }

    record Register(String username, ActorHandle<UserMessage> user, ActorRef<Boolean> replyTo) implements Request {
    }

    record Lookup(String username, ActorRef<Optional<ActorHandle<UserMessage>>> replyTo) implements Request {
    }

    record Online(ActorRef<List<String>> replyTo) implements Request {
    }

    record Broadcast(String text) implements Request {
    }

    record UserExited(String key, ActorHandle<UserMessage> user) implements Request {
    }

    private record Entry(String username, ActorHandle<UserMessage> user) {
    }

    private static final class Registrar extends AbstractBehavior<Request> {
        private final Map<String, Entry> online = new HashMap<>();

        private Registrar(ActorContext<Request> context) {
            super(context);
        }

        @Override
        public Receive<Request> createReceive() {
            return newReceiveBuilder()
                    .onMessage(Register.class, register -> {
                        register.replyTo().tell(register(register.username(), register.user()));
                        return this;
                    })
                    .onMessage(Lookup.class, lookup -> {
                        Entry entry = online.get(key(lookup.username()));
                        lookup.replyTo().tell(entry != null && entry.user().isAlive()
                                ? Optional.of(entry.user())
                                : Optional.empty());
                        return this;
                    })
                    .onMessage(Online.class, query -> {
                        List<String> names = new ArrayList<>();
                        for (Entry entry : online.values()) {
                            names.add(entry.username());
                        }
                        names.sort(String.CASE_INSENSITIVE_ORDER);
                        query.replyTo().tell(Collections.unmodifiableList(names));
                        return this;
                    })
                    .onMessage(Broadcast.class, broadcast -> {
                        for (Entry entry : online.values()) {
                            entry.user().tell(new UserMessage.Output(broadcast.text()));
                        }
                        return this;
                    })
                    .onMessage(UserExited.class, this::onUserExited)
                    .build();
        }

        private Behavior<Request> onUserExited(UserExited exited) {
            Entry entry = online.get(exited.key());
            if (entry == null || !entry.user().equals(exited.user())) {
                return this;
            }
            online.remove(exited.key());
            ExitReason reason = entry.user().exitReason().orElse(ExitReason.shutdown("stopped"));
            if (reason.kind() == ExitReason.Kind.CRASHED) {
                LOGGER.warn("User {} crashed: {} ({} online)", entry.username(), reason.describe(), online.size());
            } else {
                LOGGER.info("User {} left the game: {} ({} online)", entry.username(), reason.describe(), online.size());
            }
            return this;
        }

        private boolean register(String username, ActorHandle<UserMessage> user) {
            String key = key(username);
            Entry existing = online.get(key);
            if (existing != null && existing.user().equals(user)) {
                return true;
            }
            if (existing != null && existing.user().isAlive()) {
                LOGGER.info("Refused duplicate login for {}", username);
                return false;
            }
            if (existing != null) {
                getContext().unwatch(existing.user().ref());
            }
            online.put(key, new Entry(username, user));
            getContext().watchWith(user.ref(), new UserExited(key, user));
            LOGGER.info("User {} entered the game ({} online)", username, online.size());
            return true;
        }

        private static String key(String username) {
            return username == null ? "" : username.trim().toLowerCase(Locale.ROOT);
        }
    }
}
