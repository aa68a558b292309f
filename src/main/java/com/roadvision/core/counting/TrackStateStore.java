package com.roadvision.core.counting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Хранилище треков: track id → {@link TrackState}.
 * Записи живут до {@link #evictStale} или {@link #clear}; повторно пришедший id после вытеснения
 * считается новым треком.
 */
public final class TrackStateStore {
    private static final Logger log = LoggerFactory.getLogger(TrackStateStore.class);

    private final Map<Integer, TrackState> tracks = new HashMap<>();

    /**
     * Обновить позицию трека.
     *
     * @return позиция из предыдущего вызова для этого id, или null при первом появлении
     */
    public Center upsert(int trackId, Center center, long nowMs) {
        TrackState st = tracks.get(trackId);
        if (st == null) {
            tracks.put(trackId, new TrackState(trackId, center, nowMs));
            return null;
        }
        Center prev = st.lastCenter();
        st.moveTo(center, nowMs);
        return prev;
    }

    /** Идемпотентно: повторная отметка не меняет уже записанный счётчик. */
    public void markCounted(int trackId, String counterName) {
        TrackState st = tracks.get(trackId);
        if (st == null) {
            throw new IllegalStateException("unknown track id: " + trackId);
        }
        st.markCounted(counterName);
    }

    public boolean isCounted(int trackId) {
        TrackState st = tracks.get(trackId);
        return st != null && st.counted();
    }

    public TrackState get(int trackId) {
        return tracks.get(trackId);
    }

    /**
     * Удалить треки, не появлявшиеся дольше timeoutMs.
     *
     * @return число удалённых
     */
    public int evictStale(long nowMs, long timeoutMs) {
        int removed = 0;
        Iterator<TrackState> it = tracks.values().iterator();
        while (it.hasNext()) {
            TrackState st = it.next();
            if (nowMs - st.lastSeenMs() > timeoutMs) {
                it.remove();
                removed++;
                log.debug("Evicted {}", st);
            }
        }
        return removed;
    }

    public int size() {
        return tracks.size();
    }

    public void clear() {
        tracks.clear();
    }
}
