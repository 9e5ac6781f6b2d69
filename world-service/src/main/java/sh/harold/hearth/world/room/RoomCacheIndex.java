package sh.harold.hearth.world.room;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Shared id to room table. Anyone may read it; only {@link RoomManager} writes it.
 * Entries are never removed, so a handle read from here can be dead and must be
 * checked with {@link RoomHandle#isAlive()} before use.
 */
public final class RoomCacheIndex {

    private final ConcurrentMap<RoomId, RoomHandle> entries = new ConcurrentHashMap<>();

    /**
     * Raw lookup, the returned handle may point at a terminated room.
     */
    public Optional<RoomHandle> lookup(RoomId id) {
        return Optional.ofNullable(entries.get(id));
    }

    public Optional<RoomHandle> lookupLive(RoomId id) {
        RoomHandle handle = entries.get(id);
        return handle != null && handle.isAlive() ? Optional.of(handle) : Optional.empty();
    }

    void put(RoomHandle handle) {
        entries.put(handle.id(), handle);
    }

    public int size() {
        return entries.size();
    }

    public long liveCount() {
        return entries.values().stream().filter(RoomHandle::isAlive).count();
    }

    public List<RoomHandle> snapshot() {
        List<RoomHandle> handles = new ArrayList<>(entries.values());
        handles.sort(Comparator.comparing(RoomHandle::id));
        return handles;
    }
}
