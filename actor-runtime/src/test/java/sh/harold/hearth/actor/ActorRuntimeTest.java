package sh.harold.hearth.actor;

import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActorRuntimeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private ActorRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = new ActorRuntime("actor-runtime-test");
    }

    @AfterEach
    void tearDown() {
        runtime.shutdown(TIMEOUT);
    }

    @Test
    void spawnedActorAnswersCallsInSendOrder() {
        ActorHandle<Command> worker = spawnWorker("worker");

        for (int i = 0; i < 50; i++) {
            worker.tell(new Record("m" + i));
        }
        List<String> seen = worker.call(Dump::new, TIMEOUT);

        assertThat(seen).hasSize(50).startsWith("m0", "m1").endsWith("m49");
        assertThat(worker.isAlive()).isTrue();
        assertThat(runtime.liveActors()).contains("worker");
    }

    @Test
    void failureIsRecordedAsCrashWithItsCause() throws Exception {
        ActorHandle<Command> worker = spawnWorker("worker");

        worker.tell(new Fail("boom"));

        ExitReason reason = worker.termination().get(2, TimeUnit.SECONDS);
        assertThat(reason.kind()).isEqualTo(ExitReason.Kind.CRASHED);
        assertThat(reason.detail()).isEqualTo("boom");
        assertThat(reason.failure()).containsInstanceOf(IllegalStateException.class);
        assertThat(worker.isAlive()).isFalse();
    }

    @Test
    void stoppingWithoutRecordedReasonIsNormal() throws Exception {
        ActorHandle<Command> worker = spawnWorker("worker");

        worker.tell(new StopWith(null));

        assertThat(worker.termination().get(2, TimeUnit.SECONDS).isNormal()).isTrue();
    }

    @Test
    void firstRecordedReasonWins() throws Exception {
        ActorHandle<Command> worker = spawnWorker("worker");

        assertThat(worker.lifeline().exit(ExitReason.timeout("watchdog"))).isTrue();
        assertThat(worker.isAlive()).isFalse();
        worker.tell(new StopWith(ExitReason.killed("late")));

        assertThat(worker.termination().get(2, TimeUnit.SECONDS).kind()).isEqualTo(ExitReason.Kind.TIMEOUT);
    }

    @Test
    void failureDuringStartStillCompletesTermination() throws Exception {
        ActorHandle<Command> broken = runtime.spawn("broken", Command.class,
                lifeline -> Behaviors.setup(context -> {
                    throw new IllegalStateException("cannot start");
                }));

        ExitReason reason = broken.termination().get(2, TimeUnit.SECONDS);
        assertThat(reason.kind()).isEqualTo(ExitReason.Kind.CRASHED);
        assertThat(runtime.liveActors()).doesNotContain("broken");
    }

    @Test
    void callToStoppedActorFailsFast() throws Exception {
        ActorHandle<Command> worker = spawnWorker("worker");
        worker.tell(new StopWith(ExitReason.killed("test")));
        worker.termination().get(2, TimeUnit.SECONDS);

        assertThatThrownBy(() -> worker.call(Dump::new, Duration.ofSeconds(30)))
                .isInstanceOf(ActorCallException.class)
                .satisfies(e -> assertThat(((ActorCallException) e).getFailure())
                        .isEqualTo(ActorCallException.Failure.TERMINATED));
    }

    @Test
    void callWithoutReplyTimesOut() {
        ActorHandle<Command> worker = spawnWorker("worker");

        assertThatThrownBy(() -> worker.call(Ignore::new, Duration.ofMillis(150)))
                .isInstanceOf(ActorCallException.class)
                .satisfies(e -> assertThat(((ActorCallException) e).getFailure())
                        .isEqualTo(ActorCallException.Failure.TIMEOUT));
        assertThat(worker.isAlive()).isTrue();
    }

    @Test
    void callReturnsEarlyWhenTargetStopsWhileWaiting() {
        ActorHandle<Command> worker = spawnWorker("worker");

        long started = System.nanoTime();
        assertThatThrownBy(() -> worker.call(StopAndIgnore::new, Duration.ofSeconds(30)))
                .isInstanceOf(ActorCallException.class)
                .satisfies(e -> assertThat(((ActorCallException) e).getFailure())
                        .isEqualTo(ActorCallException.Failure.TERMINATED));
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void absorbingWatcherIsToldAndKeepsRunning() throws Exception {
        BlockingQueue<ExitReason> exits = new LinkedBlockingQueue<>();
        ActorHandle<Command> watcher = spawnWorker("watcher", spawnRecorder(exits));
        ActorHandle<Command> worker = spawnWorker("worker");
        watcher.<Boolean>call(replyTo -> new Watch(worker, SupervisionPolicy.ABSORB, replyTo), TIMEOUT);

        worker.tell(new Fail("worker failed"));

        assertThat(exits.poll(2, TimeUnit.SECONDS).kind()).isEqualTo(ExitReason.Kind.CRASHED);
        assertThat(watcher.isAlive()).isTrue();
    }

    @Test
    void propagatingWatcherStopsLinkedOnAbnormalExit() throws Exception {
        ActorHandle<Command> watcher = spawnWorker("watcher");
        ActorHandle<Command> worker = spawnWorker("worker");
        watcher.<Boolean>call(replyTo -> new Watch(worker, SupervisionPolicy.PROPAGATE, replyTo), TIMEOUT);

        worker.tell(new StopWith(ExitReason.killed("test")));

        ExitReason reason = watcher.termination().get(2, TimeUnit.SECONDS);
        assertThat(reason.kind()).isEqualTo(ExitReason.Kind.LINKED);
        assertThat(reason.detail()).contains("worker").contains("killed");
    }

    @Test
    void propagatingWatcherIgnoresNormalExit() throws Exception {
        ActorHandle<Command> watcher = spawnWorker("watcher");
        ActorHandle<Command> worker = spawnWorker("worker");
        watcher.<Boolean>call(replyTo -> new Watch(worker, SupervisionPolicy.PROPAGATE, replyTo), TIMEOUT);

        worker.tell(new StopWith(null));
        worker.termination().get(2, TimeUnit.SECONDS);

        assertThat(watcher.call(Dump::new, TIMEOUT)).isEmpty();
        assertThat(watcher.isAlive()).isTrue();
    }

    @Test
    void childInheritsShutdownWhenParentStopsNormally() throws Exception {
        ActorHandle<Command> parent = spawnWorker("parent");
        ActorHandle<Command> child = parent.call(SpawnChild::new, TIMEOUT);
        assertThat(child.call(Dump::new, TIMEOUT)).isEmpty();

        parent.tell(new StopWith(null));

        ExitReason reason = child.termination().get(2, TimeUnit.SECONDS);
        assertThat(reason.kind()).isEqualTo(ExitReason.Kind.SHUTDOWN);
        assertThat(reason.isAbnormal()).isTrue();
    }

    @Test
    void childIsLinkedWhenParentCrashes() throws Exception {
        ActorHandle<Command> parent = spawnWorker("parent");
        ActorHandle<Command> child = parent.call(SpawnChild::new, TIMEOUT);

        parent.tell(new Fail("parent failed"));

        ExitReason reason = child.termination().get(2, TimeUnit.SECONDS);
        assertThat(reason.kind()).isEqualTo(ExitReason.Kind.LINKED);
        assertThat(reason.detail()).contains("parent failed");
    }

    @Test
    void shutdownStopsEveryLiveActor() {
        List<ActorHandle<Command>> workers = List.of(spawnWorker("a"), spawnWorker("b"), spawnWorker("c"));
        assertThat(runtime.liveActorCount()).isEqualTo(3);

        runtime.shutdown(TIMEOUT);

        assertThat(workers).allSatisfy(worker -> {
            assertThat(worker.termination()).succeedsWithin(TIMEOUT);
            assertThat(worker.exitReason()).hasValueSatisfying(
                    reason -> assertThat(reason.kind()).isEqualTo(ExitReason.Kind.SHUTDOWN));
        });
        assertThat(runtime.liveActorCount()).isZero();
        assertThat(runtime.isRunning()).isFalse();
        assertThatThrownBy(() -> spawnWorker("late")).isInstanceOf(IllegalStateException.class);
    }

    private ActorRef<ExitReason> spawnRecorder(BlockingQueue<ExitReason> exits) {
        return runtime.spawn("recorder", ExitReason.class, lifeline -> Behaviors.receive(ExitReason.class)
                .onMessage(ExitReason.class, reason -> {
                    exits.add(reason);
                    return Behaviors.same();
                })
                .build()).ref();
    }

    private ActorHandle<Command> spawnWorker(String name) {
        return spawnWorker(name, null);
    }

    private ActorHandle<Command> spawnWorker(String name, ActorRef<ExitReason> exits) {
        return runtime.spawn(name, Command.class, lifeline -> Worker.create(lifeline, exits));
    }

    sealed interface Command permits Record, Dump, Ignore, Fail, StopWith, StopAndIgnore, Watch, WatchedExited, SpawnChild {
    }

    record Record(String value) implements Command {
    }

    record Dump(ActorRef<List<String>> replyTo) implements Command {
    }

    record Ignore(ActorRef<List<String>> replyTo) implements Command {
    }

    record Fail(String message) implements Command {
    }

    record StopWith(ExitReason reason) implements Command {
    }

    record StopAndIgnore(ActorRef<List<String>> replyTo) implements Command {
    }

    record Watch(ActorHandle<Command> target, SupervisionPolicy policy, ActorRef<Boolean> replyTo) implements Command {
    }

    record WatchedExited(ActorHandle<Command> target, SupervisionPolicy policy) implements Command {
    }

    record SpawnChild(ActorRef<ActorHandle<Command>> replyTo) implements Command {
    }

    static final class Worker extends AbstractBehavior<Command> {
        private final Lifeline lifeline;
        private final ActorRef<ExitReason> exits;
        private final List<String> seen = new ArrayList<>();
        private int children;

        private Worker(ActorContext<Command> context, Lifeline lifeline, ActorRef<ExitReason> exits) {
            super(context);
            this.lifeline = lifeline;
            this.exits = exits;
        }

        static Behavior<Command> create(Lifeline lifeline, ActorRef<ExitReason> exits) {
            return Behaviors.setup(context -> new Worker(context, lifeline, exits));
        }

        @Override
        public Receive<Command> createReceive() {
            return newReceiveBuilder()
                    .onMessage(Record.class, record -> {
                        seen.add(record.value());
                        return this;
                    })
                    .onMessage(Dump.class, dump -> {
                        dump.replyTo().tell(List.copyOf(seen));
                        return this;
                    })
                    .onMessage(Ignore.class, ignore -> this)
                    .onMessage(Fail.class, fail -> {
                        throw new IllegalStateException(fail.message());
                    })
                    .onMessage(StopWith.class, stop -> {
                        if (stop.reason() != null) {
                            lifeline.exit(stop.reason());
                        }
                        return Behaviors.stopped();
                    })
                    .onMessage(StopAndIgnore.class, stop -> Behaviors.stopped())
                    .onMessage(Watch.class, watch -> {
                        getContext().watchWith(watch.target().ref(), new WatchedExited(watch.target(), watch.policy()));
                        watch.replyTo().tell(true);
                        return this;
                    })
                    .onMessage(WatchedExited.class, this::onWatchedExited)
                    .onMessage(SpawnChild.class, spawn -> {
                        children++;
                        spawn.replyTo().tell(ActorRuntime.spawnChild(getContext(), lifeline, "child-" + children,
                                Command.class, childLifeline -> Worker.create(childLifeline, null)));
                        return this;
                    })
                    .build();
        }

        private Behavior<Command> onWatchedExited(WatchedExited exited) {
            ExitReason reason = exited.target().exitReason().orElseThrow();
            if (exits != null) {
                exits.tell(reason);
            }
            if (exited.policy().stopsWatcher(reason)) {
                lifeline.exit(ExitReason.linked(exited.target().name(), reason));
                return Behaviors.stopped();
            }
            return this;
        }
    }
}
