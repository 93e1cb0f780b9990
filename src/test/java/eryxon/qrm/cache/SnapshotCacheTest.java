package eryxon.qrm.cache;

import eryxon.qrm.error.SubscriptionChannelException;
import eryxon.qrm.error.TransportException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotCacheTest {

    @Test
    void unknownKeyReadsEmpty() {
        SnapshotCache<String> cache = new SnapshotCache<>();

        SnapshotState<?> state = cache.read("k");
        assertEquals(LoadState.EMPTY, state.status());
        assertNull(state.value());
        assertFalse(cache.contains("k"));
    }

    @Test
    void loadThenWrite() {
        SnapshotCache<String> cache = new SnapshotCache<>();
        SnapshotCache<String>.Slot<String> slot = cache.open("k");
        assertThrows(IllegalStateException.class, () -> cache.open("k"));

        long gen = slot.beginLoad();
        assertTrue(slot.state().isLoading());

        assertTrue(slot.write(gen, "v1"));
        SnapshotState<String> state = slot.state();
        assertEquals(LoadState.READY, state.status());
        assertEquals("v1", state.value());
        assertEquals(gen, state.generation());
        assertEquals("v1", cache.read("k").value());
    }

    @Test
    void staleResultIsDropped() {
        SnapshotCache<String> cache = new SnapshotCache<>();
        SnapshotCache<String>.Slot<String> slot = cache.open("k");

        long first = slot.beginLoad();
        long second = slot.beginLoad();

        // second resolves first, then the older one arrives late
        assertTrue(slot.write(second, "new"));
        assertFalse(slot.write(first, "old"));
        assertFalse(slot.fail(first, new TransportException("late")));

        assertEquals("new", slot.state().value());
        assertFalse(slot.state().hasError());
    }

    @Test
    void failureKeepsLastValue() {
        SnapshotCache<String> cache = new SnapshotCache<>();
        SnapshotCache<String>.Slot<String> slot = cache.open("k");
        slot.write(slot.beginLoad(), "good");

        TransportException error = new TransportException("down");
        assertTrue(slot.fail(slot.beginLoad(), error));

        SnapshotState<String> state = slot.state();
        assertEquals(LoadState.FAILED, state.status());
        assertEquals("good", state.value());
        assertSame(error, state.error());

        slot.write(slot.beginLoad(), "better");
        assertNull(slot.state().error());
    }

    @Test
    void resultForDiscardedSlotNeverLandsInReopenedSlot() {
        SnapshotCache<String> cache = new SnapshotCache<>();
        SnapshotCache<String>.Slot<String> old = cache.open("k");
        long oldGen = old.beginLoad();

        cache.discard("k");
        assertFalse(cache.contains("k"));
        assertFalse(old.isOpen());
        assertFalse(old.write(oldGen, "orphan"));
        assertEquals(-1, old.beginLoad());

        SnapshotCache<String>.Slot<String> reopened = cache.open("k");
        long fresh = reopened.beginLoad();
        assertNotEquals(oldGen, fresh);
        assertFalse(reopened.write(oldGen, "orphan"));
        assertTrue(reopened.write(fresh, "fresh"));
        assertEquals("fresh", cache.read("k").value());
        assertEquals(LoadState.EMPTY, old.state().status());
    }

    @Test
    void channelErrorLeavesValueAlone() {
        SnapshotCache<String> cache = new SnapshotCache<>();
        SnapshotCache<String>.Slot<String> slot = cache.open("k");
        slot.write(slot.beginLoad(), "v");

        slot.channelState(new SubscriptionChannelException("ch", "down", null));
        SnapshotState<String> state = slot.state();
        assertFalse(state.isChannelHealthy());
        assertEquals(LoadState.READY, state.status());
        assertEquals("v", state.value());

        slot.channelState(null);
        assertTrue(slot.state().isChannelHealthy());
    }

    @Test
    void invalidateSupersedesInFlightLoads() {
        SnapshotCache<String> cache = new SnapshotCache<>();
        SnapshotCache<String>.Slot<String> slot = cache.open("k");
        slot.write(slot.beginLoad(), "v");
        long inFlight = slot.beginLoad();

        slot.invalidate();

        assertEquals(LoadState.EMPTY, slot.state().status());
        assertNull(slot.state().value());
        assertFalse(slot.write(inFlight, "late"));
        assertEquals(1, cache.size());
    }

    @Test
    void mapConvertsValueAndKeepsTheRest() {
        SnapshotCache<String> cache = new SnapshotCache<>();
        SnapshotCache<String>.Slot<String> slot = cache.open("k");
        long gen = slot.beginLoad();
        slot.write(gen, "42");

        SnapshotState<Integer> mapped = slot.state().map(Integer::valueOf);

        assertEquals(Integer.valueOf(42), mapped.value());
        assertEquals(LoadState.READY, mapped.status());
        assertEquals(gen, mapped.generation());
        assertNull(SnapshotState.<String>empty().map(Integer::valueOf).value());
    }
}
