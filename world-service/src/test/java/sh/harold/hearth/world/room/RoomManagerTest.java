package sh.harold.hearth.world.room;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sh.harold.hearth.actor.ActorHandle;
import sh.harold.hearth.actor.ActorRuntime;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.world.TestWorld;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
final class RoomManagerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path dataDirectory;

    @Mock
    private RoomStore mockStore;

    private ActorRuntime runtime;
    private CountingStore store;
    private RoomManager rooms;

    @BeforeEach
    void setUp() {
        TestWorld.writeSampleRooms(dataDirectory);
        runtime = new ActorRuntime("room-manager-test");
        store = new CountingStore(new FileRoomStore(dataDirectory));
        rooms = new RoomManager(runtime, store, TIMEOUT);
    }

    @AfterEach
    void tearDown() {
        runtime.shutdown(Duration.ofSeconds(2));
    }

    @Test
    void concurrentLookupsLoadTheRoomOnce() throws Exception {
        int callers = 32;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<RoomResult>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                Callable<RoomResult> lookup = () -> {
                    start.await();
                    return rooms.getRoom(RoomId.of("square"));
                };
                results.add(pool.submit(lookup));
            }
            start.countDown();

            List<RoomHandle> handles = new ArrayList<>();
            for (Future<RoomResult> result : results) {
                handles.add(result.get(5, TimeUnit.SECONDS).handle().orElseThrow());
            }

            assertThat(handles).allSatisfy(handle -> assertThat(handle.actor()).isEqualTo(handles.get(0).actor()));
            assertThat(store.loads.get()).isEqualTo(1);
            assertThat(rooms.loadAttempts()).isEqualTo(1);
            assertThat(rooms.roomsSpawned()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void cachedLiveRoomIsServedWithoutTheCoordinator() {
        RoomHandle first = rooms.getRoom(RoomId.of("market")).handle().orElseThrow();
        RoomHandle second = rooms.getRoom(RoomId.of("market")).handle().orElseThrow();

        assertThat(second).isSameAs(first);
        assertThat(store.loads.get()).isEqualTo(1);
    }

    @Test
    void missingRoomIsNotFound() {
        RoomResult result = rooms.getRoom(RoomId.of("garden"));

        assertThat(result).isEqualTo(new RoomResult.Failed(RoomError.NOT_FOUND));
        assertThat(rooms.index().lookup(RoomId.of("garden"))).isEmpty();
    }

    @Test
    void deadRoomIsReloadedOnNextLookup() {
        RoomHandle original = rooms.getRoom(RoomId.of("square")).handle().orElseThrow();
        original.stop(ExitReason.killed("test"));
        TestWorld.waitFor(() -> !original.isAlive(), TIMEOUT);

        RoomHandle reloaded = rooms.getRoom(RoomId.of("square")).handle().orElseThrow();

        assertThat(reloaded.isAlive()).isTrue();
        assertThat(reloaded.actor()).isNotEqualTo(original.actor());
        assertThat(rooms.index().lookup(RoomId.of("square"))).contains(reloaded);
        assertThat(store.loads.get()).isEqualTo(2);
    }

    @Test
    void lookupNeverReturnsADeadHandle() {
        for (int i = 0; i < 5; i++) {
            RoomHandle handle = rooms.getRoom(RoomId.of("tavern")).handle().orElseThrow();
            assertThat(handle.isAlive()).isTrue();
            handle.stop(ExitReason.killed("round " + i));
            TestWorld.waitFor(() -> !handle.isAlive(), TIMEOUT);
        }
        assertThat(rooms.roomsSpawned()).isEqualTo(5);
    }

    @Test
    void newRoomCreatesADefaultRoom() {
        RoomResult result = rooms.newRoom(RoomId.of("attic"));

        RoomHandle attic = result.handle().orElseThrow();
        assertThat(attic.getName()).isEqualTo(RoomManager.DEFAULT_TITLE);
        assertThat(attic.describe().brief()).isEqualTo(RoomManager.DEFAULT_BRIEF);
        assertThat(rooms.getRoom(RoomId.of("attic")).handle()).contains(attic);
    }

    @Test
    void newRoomRefusesALiveRoom() {
        rooms.getRoom(RoomId.of("square"));

        assertThat(rooms.newRoom(RoomId.of("square"))).isEqualTo(RoomResult.alreadyExists());
    }

    @Test
    void newRoomRefusesARoomThatHasADefinition() {
        RoomResult result = rooms.newRoom(RoomId.of("docks"));

        assertThat(result).isEqualTo(RoomResult.alreadyExists());
        assertThat(rooms.index().lookupLive(RoomId.of("docks"))).isPresent();
        assertThat(rooms.getRoom(RoomId.of("docks")).handle().orElseThrow().getName()).isEqualTo("The Docks");
    }

    @Test
    void concurrentCreationHasExactlyOneWinner() throws Exception {
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<RoomResult>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return rooms.newRoom(RoomId.of("cellar"));
                }));
            }
            start.countDown();

            int created = 0;
            int refused = 0;
            for (Future<RoomResult> result : results) {
                RoomResult outcome = result.get(5, TimeUnit.SECONDS);
                if (outcome.isFound()) {
                    created++;
                } else {
                    assertThat(outcome).isEqualTo(RoomResult.alreadyExists());
                    refused++;
                }
            }
            assertThat(created).isEqualTo(1);
            assertThat(refused).isEqualTo(callers - 1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void coordinatorIsReplacedAfterItDies() {
        ActorHandle<RoomManager.Request> coordinator = rooms.coordinator();
        coordinator.tell(new RoomManager.StopCoordinator(ExitReason.killed("test")));
        TestWorld.waitFor(() -> !coordinator.isAlive(), TIMEOUT);

        RoomResult result = rooms.getRoom(RoomId.of("market"));

        assertThat(result.isFound()).isTrue();
        assertThat(rooms.coordinator()).isNotEqualTo(coordinator);
        assertThat(rooms.coordinator().isAlive()).isTrue();
    }

    @Test
    void failingStoreIsReportedAsNotFound() {
        when(mockStore.load(any())).thenThrow(new IllegalStateException("disk on fire"));
        RoomManager manager = new RoomManager(runtime, mockStore, TIMEOUT);

        assertThat(manager.getRoom(RoomId.of("square"))).isEqualTo(RoomResult.notFound());
        assertThat(manager.loadAttempts()).isEqualTo(1);
        assertThat(manager.roomsSpawned()).isZero();
    }

    @Test
    void fastPathSkipsTheStoreForLiveRooms() {
        RoomCacheIndex index = new RoomCacheIndex();
        RoomManager manager = new RoomManager(runtime, mockStore, index, TIMEOUT);
        ActorHandle<RoomMessage> prebuilt = runtime.spawn("room:prebuilt", RoomMessage.class,
                lifeline -> RoomActor.create(RoomRecord.blank(RoomId.of("prebuilt"), "Prebuilt", "Made by hand."), lifeline));
        RoomHandle handle = new RoomHandle(RoomId.of("prebuilt"), prebuilt, TIMEOUT);
        index.put(handle);

        assertThat(manager.getRoom(RoomId.of("prebuilt")).handle()).contains(handle);
        verify(mockStore, never()).load(any());
    }

    private static final class CountingStore implements RoomStore {
        private final RoomStore delegate;
        private final AtomicInteger loads = new AtomicInteger();

        private CountingStore(RoomStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public Optional<RoomRecord> load(RoomId id) {
            loads.incrementAndGet();
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return delegate.load(id);
        }
    }
}
