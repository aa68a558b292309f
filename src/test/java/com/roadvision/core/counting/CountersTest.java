package com.roadvision.core.counting;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CountersTest {

    @Test
    void registeredNamesAppearWithZero() {
        Counters c = new Counters();
        c.register(List.of("down", "up"));
        assertEquals(Map.of("down", 0, "up", 0), c.snapshot().counters());
        assertEquals(0, c.total());
    }

    @Test
    void totalIsDerivedFromCounters() {
        Counters c = new Counters();
        c.register(List.of("down", "up"));
        c.increment("down");
        c.increment("down");
        c.increment("up");
        assertEquals(3, c.total());
        assertEquals(3, c.snapshot().total());
    }

    @Test
    void zeroKeepsNames() {
        Counters c = new Counters();
        c.register(List.of("down"));
        c.increment("down");
        c.zero();
        assertEquals(0, c.get("down"));
        assertTrue(c.snapshot().counters().containsKey("down"));
    }

    @Test
    void snapshotIsDetached() {
        Counters c = new Counters();
        c.register(List.of("down"));
        CountSnapshot before = c.snapshot();
        c.increment("down");
        assertEquals(0, before.get("down"));
        assertThrows(UnsupportedOperationException.class, () -> before.counters().put("x", 1));
    }
}
