package sh.harold.hearth.actor;

import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.ActorSystem;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.DispatcherSelector;
import org.apache.pekko.actor.typed.Props;
import org.apache.pekko.actor.typed.SpawnProtocol;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.AskPattern;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Owns the Pekko {@link ActorSystem} and hands out {@link ActorHandle}s for the actors spawned in it.
 *
 * <p>Every actor spawned here, top level or child, is tracked through its {@link Lifeline}, so the
 * runtime can report what is still alive without walking the actor tree.
 */
public final class ActorRuntime implements AutoCloseable {

    /** Dispatcher for actors that block on calls to other actors. */
    public static final String BLOCKING_DISPATCHER = "hearth.actor.blocking-dispatcher";
    /** Executor for work that runs outside any actor, such as command handlers. */
    public static final String REQUEST_DISPATCHER = "hearth.actor.request-dispatcher";

    private static final Logger LOGGER = LoggerFactory.getLogger(ActorRuntime.class);
    private static final Duration SPAWN_TIMEOUT = Duration.ofSeconds(5);

    private final ActorSystem<SpawnProtocol.Command> system;
    private final Set<Lifeline> live = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(true);

    public ActorRuntime(String name) {
        this.system = ActorSystem.create(SpawnProtocol.create(), name);
        LOGGER.info("Actor runtime '{}' started", name);
    }

    /**
     * Props that place an actor on {@link #BLOCKING_DISPATCHER}.
     */
    public static Props blocking() {
        return DispatcherSelector.fromConfig(BLOCKING_DISPATCHER);
    }

    public <M> ActorHandle<M> spawn(String name, Class<M> protocol, Function<Lifeline, Behavior<M>> factory) {
        return spawn(name, protocol, factory, Props.empty());
    }

    /**
     * Spawns a top-level actor and waits until it exists. Duplicate names are made unique by Pekko.
     *
     * @throws IllegalStateException when the runtime has been shut down
     */
    public <M> ActorHandle<M> spawn(String name, Class<M> protocol, Function<Lifeline, Behavior<M>> factory, Props props) {
        if (!running.get()) {
            throw new IllegalStateException("Actor runtime is shut down, cannot spawn " + name);
        }
        Lifeline lifeline = new Lifeline(name, null, live);
        Behavior<M> behavior = track(protocol, lifeline, factory.apply(lifeline));
        try {
            ActorRef<M> ref = AskPattern.<SpawnProtocol.Command, ActorRef<M>>ask(
                            system,
                            replyTo -> new SpawnProtocol.Spawn<>(behavior, actorName(name), props, replyTo),
                            SPAWN_TIMEOUT,
                            system.scheduler())
                    .toCompletableFuture()
                    .get(SPAWN_TIMEOUT.toMillis() + 1_000, TimeUnit.MILLISECONDS);
            return new ActorHandle<>(ref, lifeline, system.scheduler());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lifeline.exit(ExitReason.killed("spawn interrupted"));
            lifeline.terminated();
            throw new IllegalStateException("Interrupted while spawning " + name, e);
        } catch (ExecutionException | TimeoutException e) {
            lifeline.exit(ExitReason.crashed(e));
            lifeline.terminated();
            throw new IllegalStateException("Could not spawn " + name, e);
        }
    }

    /**
     * Spawns a child of the actor owning {@code context}. The child stops with its parent and, unless
     * it recorded its own reason, inherits the parent's.
     */
    public static <C> ActorHandle<C> spawnChild(ActorContext<?> context, Lifeline parent, String name,
                                                Class<C> protocol, Function<Lifeline, Behavior<C>> factory) {
        return spawnChild(context, parent, name, protocol, factory, Props.empty());
    }

    public static <C> ActorHandle<C> spawnChild(ActorContext<?> context, Lifeline parent, String name,
                                                Class<C> protocol, Function<Lifeline, Behavior<C>> factory,
                                                Props props) {
        Lifeline lifeline = parent.child(name);
        ActorRef<C> ref = context.spawn(track(protocol, lifeline, factory.apply(lifeline)), actorName(name), props);
        return new ActorHandle<>(ref, lifeline, context.getSystem().scheduler());
    }

    private static <M> Behavior<M> track(Class<M> protocol, Lifeline lifeline, Behavior<M> behavior) {
        return Behaviors.<M, M>intercept(() -> new LifelineInterceptor<>(protocol, lifeline), behavior);
    }

    private static String actorName(String name) {
        return URLEncoder.encode(name, StandardCharsets.UTF_8);
    }

    public ActorSystem<SpawnProtocol.Command> system() {
        return system;
    }

    public boolean isRunning() {
        return running.get();
    }

    public List<String> liveActors() {
        return live.stream().filter(Lifeline::isAlive).map(Lifeline::name).sorted().toList();
    }

    public int liveActorCount() {
        return (int) live.stream().filter(Lifeline::isAlive).count();
    }

    /**
     * Terminates the actor system and waits up to {@code grace} for every actor to stop.
     */
    public void shutdown(Duration grace) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        LOGGER.info("Shutting down actor runtime '{}' ({} live actors)", system.name(), liveActorCount());
        system.terminate();
        try {
            system.getWhenTerminated().toCompletableFuture().get(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warn("Actor runtime '{}' did not stop within {}ms", system.name(), grace.toMillis(), e);
        }
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(5));
    }
}
