package sh.harold.hearth.world.game;

import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sh.harold.hearth.actor.ActorHandle;
import sh.harold.hearth.actor.ActorRuntime;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.actor.Lifeline;
import sh.harold.hearth.world.TestWorld;
import sh.harold.hearth.world.user.UserMessage;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

final class GameRegistryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ActorRuntime runtime;
    private GameRegistry registry;

    @BeforeEach
    void setUp() {
        runtime = new ActorRuntime("game-registry-test");
        registry = new GameRegistry(runtime, TIMEOUT);
    }

    @AfterEach
    void tearDown() {
        runtime.shutdown(Duration.ofSeconds(2));
    }

    @Test
    void registeredUsersCanBeLookedUpByAnyCase() {
        ActorHandle<UserMessage> ann = spawn("Ann", new StandInUser());

        assertThat(registry.register("Ann", ann)).isTrue();

        assertThat(registry.lookup("ANN")).contains(ann);
        assertThat(registry.isOnline("ann")).isTrue();
        assertThat(registry.isOnline("bob")).isFalse();
    }

    @Test
    void secondLiveUserWithTheSameNameIsRefused() {
        ActorHandle<UserMessage> first = spawn("Ann", new StandInUser());
        ActorHandle<UserMessage> second = spawn("ann", new StandInUser());

        assertThat(registry.register("Ann", first)).isTrue();
        assertThat(registry.register("ann", second)).isFalse();
        assertThat(registry.register("Ann", first)).isTrue();
        assertThat(registry.lookup("ann")).contains(first);
    }

    @Test
    void nameIsFreedOnceTheHolderIsDead() {
        ActorHandle<UserMessage> first = spawn("Ann", new StandInUser());
        registry.register("Ann", first);
        first.tell(new UserMessage.Stop(ExitReason.killed("test")));
        TestWorld.waitFor(() -> !first.isAlive(), TIMEOUT);

        ActorHandle<UserMessage> second = spawn("Ann", new StandInUser());

        assertThat(registry.register("Ann", second)).isTrue();
        assertThat(registry.lookup("Ann")).contains(second);
    }

    @Test
    void crashedUserIsRemovedAndTheRegistrySurvives() {
        ActorHandle<UserMessage> ann = spawn("Ann", new StandInUser());
        ActorHandle<UserMessage> bob = spawn("Bob", new StandInUser());
        registry.register("Ann", ann);
        registry.register("Bob", bob);

        ann.tell(new UserMessage.Output("crash"));

        TestWorld.waitFor(() -> registry.onlineUsers().equals(List.of("Bob")), TIMEOUT);
        assertThat(ann.exitReason().orElseThrow().kind()).isEqualTo(ExitReason.Kind.CRASHED);
        assertThat(registry.registrar().isAlive()).isTrue();
        assertThat(registry.lookup("Ann")).isEmpty();
    }

    @Test
    void onlineUsersAreSortedIgnoringCase() {
        registry.register("carol", spawn("carol", new StandInUser()));
        registry.register("Bob", spawn("Bob", new StandInUser()));
        registry.register("ann", spawn("ann", new StandInUser()));

        assertThat(registry.onlineUsers()).containsExactly("ann", "Bob", "carol");
    }

    @Test
    void broadcastReachesEveryone() throws Exception {
        StandInUser ann = new StandInUser();
        StandInUser bob = new StandInUser();
        registry.register("Ann", spawn("Ann", ann));
        registry.register("Bob", spawn("Bob", bob));

        registry.broadcast("The tide is coming in.");

        assertThat(ann.output.poll(2, TimeUnit.SECONDS)).isEqualTo("The tide is coming in.");
        assertThat(bob.output.poll(2, TimeUnit.SECONDS)).isEqualTo("The tide is coming in.");
    }

    private ActorHandle<UserMessage> spawn(String name, StandInUser user) {
        return runtime.spawn("user:" + name, UserMessage.class, user::behavior);
    }

    private static final class StandInUser {
        private final BlockingQueue<String> output = new LinkedBlockingQueue<>();

        Behavior<UserMessage> behavior(Lifeline lifeline) {
            return Behaviors.receive(UserMessage.class)
                    .onMessage(UserMessage.Output.class, text -> {
                        if (text.text().equals("crash")) {
                            throw new IllegalStateException("asked to crash");
                        }
                        output.add(text.text());
                        return Behaviors.same();
                    })
                    .onMessage(UserMessage.Stop.class, stop -> {
                        lifeline.exit(stop.reason());
                        return Behaviors.stopped();
                    })
                    .build();
        }
    }
}
