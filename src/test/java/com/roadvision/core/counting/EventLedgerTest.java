package com.roadvision.core.counting;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventLedgerTest {

    private static CrossingEvent event(long t, int x, String line) {
        return new CrossingEvent(t, new Center(x, 240), line, "down");
    }

    @Test
    void nearbyRecentEventOnSameLineIsDuplicate() {
        EventLedger ledger = new EventLedger(1_000, 50);
        ledger.append(event(0, 300, "main"));

        assertTrue(ledger.isDuplicate("main", new Center(340, 245), 500));
        assertTrue(ledger.isDuplicate("main", new Center(250, 230), 1_000));
    }

    @Test
    void otherLineFarOrOldIsNotDuplicate() {
        EventLedger ledger = new EventLedger(1_000, 50);
        ledger.append(event(0, 300, "main"));

        assertFalse(ledger.isDuplicate("second", new Center(300, 240), 100));
        assertFalse(ledger.isDuplicate("main", new Center(351, 240), 100));
        assertFalse(ledger.isDuplicate("main", new Center(300, 240), 1_001));
    }

    @Test
    void pruneDropsOnlyExpiredEvents() {
        EventLedger ledger = new EventLedger(1_000, 50);
        ledger.append(event(0, 100, "main"));
        ledger.append(event(600, 200, "main"));
        ledger.append(event(1_200, 300, "main"));

        assertEquals(1, ledger.prune(1_500));
        assertEquals(2, ledger.size());
        assertEquals(600, ledger.snapshot().get(0).timestampMs());
    }

    @Test
    void negativeParametersRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EventLedger(-1, 10));
        assertThrows(IllegalArgumentException.class, () -> new EventLedger(10, -1));
    }
}
