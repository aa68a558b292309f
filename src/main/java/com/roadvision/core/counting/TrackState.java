package com.roadvision.core.counting;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Состояние одного трека: последняя позиция, признак "уже посчитан", время последнего появления.
 * Признак counted глобальный: трек, посчитанный на любой линии, больше не считается нигде.
 */
public final class TrackState {
    private final int trackId;
    private final long firstSeenMs;
    private Center lastCenter;
    private long lastSeenMs;
    private boolean counted;
    private String countedAs;   // имя счётчика, null пока не посчитан
    // линия → последний y трека вне её полосы допуска
    private final Map<String, Integer> outsideY = new HashMap<>();

    TrackState(int trackId, Center center, long nowMs) {
        this.trackId = trackId;
        this.firstSeenMs = nowMs;
        this.lastCenter = center;
        this.lastSeenMs = nowMs;
    }

    void moveTo(Center center, long nowMs) {
        this.lastCenter = center;
        this.lastSeenMs = nowMs;
    }

    void noteOutside(List<CountingLine> lines, int y) {
        for (CountingLine l : lines) {
            if (!l.inBand(y)) {
                outsideY.put(l.name(), y);
            }
        }
    }

    /** Последний y вне полосы линии или null, если трек ещё не был вне неё. */
    public Integer lastOutsideY(String lineName) {
        return outsideY.get(lineName);
    }

    void markCounted(String counterName) {
        if (counted) return;
        this.counted = true;
        this.countedAs = counterName;
    }

    public int trackId() {
        return trackId;
    }

    public Center lastCenter() {
        return lastCenter;
    }

    public long firstSeenMs() {
        return firstSeenMs;
    }

    public long lastSeenMs() {
        return lastSeenMs;
    }

    public boolean counted() {
        return counted;
    }

    public String countedAs() {
        return countedAs;
    }

    @Override
    public String toString() {
        return "Track[id=" + trackId + ", at=" + lastCenter + ", counted=" + counted
                + (countedAs != null ? " as " + countedAs : "") + ", lastSeen=" + lastSeenMs + "]";
    }
}
