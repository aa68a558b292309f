package com.roadvision.core.counting;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TrackStateStoreTest {

    @Test
    void upsertReturnsPreviousPosition() {
        TrackStateStore store = new TrackStateStore();
        assertNull(store.upsert(1, new Center(10, 20), 0));
        assertEquals(new Center(10, 20), store.upsert(1, new Center(11, 25), 40));
        assertEquals(new Center(11, 25), store.upsert(1, new Center(12, 30), 80));
        assertEquals(80, store.get(1).lastSeenMs());
        assertEquals(0, store.get(1).firstSeenMs());
    }

    @Test
    void markCountedIsIdempotent() {
        TrackStateStore store = new TrackStateStore();
        store.upsert(7, new Center(0, 0), 0);
        store.markCounted(7, "down");
        store.markCounted(7, "up");
        assertTrue(store.isCounted(7));
        assertEquals("down", store.get(7).countedAs());
    }

    @Test
    void markUnknownTrackFails() {
        TrackStateStore store = new TrackStateStore();
        assertThrows(IllegalStateException.class, () -> store.markCounted(99, "down"));
    }

    @Test
    void evictRemovesOnlyTracksOlderThanTimeout() {
        TrackStateStore store = new TrackStateStore();
        store.upsert(1, new Center(0, 0), 0);
        store.upsert(2, new Center(0, 0), 1_000);
        store.upsert(3, new Center(0, 0), 2_500);

        int removed = store.evictStale(3_000, 2_000);

        assertEquals(1, removed);
        assertNull(store.get(1));
        assertNotNull(store.get(2), "exactly at timeout stays");
        assertNotNull(store.get(3));
    }

    @Test
    void evictedIdComesBackUncounted() {
        TrackStateStore store = new TrackStateStore();
        store.upsert(5, new Center(0, 100), 0);
        store.markCounted(5, "down");
        store.evictStale(10_000, 2_000);

        assertNull(store.upsert(5, new Center(0, 100), 10_000), "first sighting again");
        assertFalse(store.isCounted(5));
    }

    @Test
    void clearEmptiesStore() {
        TrackStateStore store = new TrackStateStore();
        store.upsert(1, new Center(0, 0), 0);
        store.upsert(2, new Center(0, 0), 0);
        store.clear();
        assertEquals(0, store.size());
    }
}
