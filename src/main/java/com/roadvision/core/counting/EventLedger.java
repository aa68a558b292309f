package com.roadvision.core.counting;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Журнал недавних событий для режима без трекинга.
 * Событие подавляет повторный счёт на той же линии, если новая детекция ближе distancePx по x
 * и не старше windowMs. Журнал только дополняется и чистится по возрасту.
 */
public final class EventLedger {
    private final long windowMs;
    private final int distancePx;
    // события добавляются в порядке времени, старые в голове
    private final Deque<CrossingEvent> events = new ArrayDeque<>();

    public EventLedger(long windowMs, int distancePx) {
        if (windowMs < 0) {
            throw new IllegalArgumentException("windowMs must be >= 0: " + windowMs);
        }
        if (distancePx < 0) {
            throw new IllegalArgumentException("distancePx must be >= 0: " + distancePx);
        }
        this.windowMs = windowMs;
        this.distancePx = distancePx;
    }

    /** Есть ли свежее событие рядом на той же линии. */
    public boolean isDuplicate(String lineName, Center position, long nowMs) {
        Iterator<CrossingEvent> it = events.descendingIterator();
        while (it.hasNext()) {
            CrossingEvent e = it.next();
            if (nowMs - e.timestampMs() > windowMs) {
                break;
            }
            if (e.lineName().equals(lineName)
                    && Math.abs(e.position().x() - position.x()) <= distancePx) {
                return true;
            }
        }
        return false;
    }

    public void append(CrossingEvent e) {
        events.addLast(e);
    }

    /** Удалить события старше окна. */
    public int prune(long nowMs) {
        int removed = 0;
        while (!events.isEmpty() && nowMs - events.peekFirst().timestampMs() > windowMs) {
            events.pollFirst();
            removed++;
        }
        return removed;
    }

    public List<CrossingEvent> snapshot() {
        return List.copyOf(events);
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
