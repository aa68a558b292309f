package com.roadvision.core.counting;

import com.roadvision.core.roi.EdgeMarginRoi;
import com.roadvision.core.roi.RoiFilter;

import java.util.Set;

/**
 * Неизменяемые параметры сессии подсчёта.
 *
 * @param eligibleClassIds классы детектора, считающиеся транспортом; пустое множество = все классы
 */
public record SessionSettings(
        CountingMode mode,
        long trackTimeoutMs,
        long dedupWindowMs,
        int dedupDistancePx,
        Set<Integer> eligibleClassIds,
        double minConfidence,
        RoiFilter roi,
        CrossingReference crossingReference
) {
    public static final long DEFAULT_TRACK_TIMEOUT_MS = 2_000L;
    public static final long DEFAULT_DEDUP_WINDOW_MS = 1_000L;
    public static final int DEFAULT_DEDUP_DISTANCE_PX = 50;

    public SessionSettings {
        if (mode == null) mode = CountingMode.TRACKED;
        if (trackTimeoutMs <= 0) {
            throw new IllegalArgumentException("trackTimeoutMs must be positive: " + trackTimeoutMs);
        }
        if (dedupWindowMs < 0) {
            throw new IllegalArgumentException("dedupWindowMs must be >= 0: " + dedupWindowMs);
        }
        if (dedupDistancePx < 0) {
            throw new IllegalArgumentException("dedupDistancePx must be >= 0: " + dedupDistancePx);
        }
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be in [0,1]: " + minConfidence);
        }
        eligibleClassIds = eligibleClassIds == null ? Set.of() : Set.copyOf(eligibleClassIds);
        if (roi == null) roi = new EdgeMarginRoi();
        if (crossingReference == null) crossingReference = CrossingReference.PREVIOUS_POSITION;
    }

    /** Значения по умолчанию: трекинг, таймаут 2 с, окно 1 с / 50 px, все классы, поле 5%. */
    public static SessionSettings defaults(CountingMode mode) {
        return new SessionSettings(mode, DEFAULT_TRACK_TIMEOUT_MS, DEFAULT_DEDUP_WINDOW_MS,
                DEFAULT_DEDUP_DISTANCE_PX, Set.of(), 0.0, new EdgeMarginRoi(), CrossingReference.PREVIOUS_POSITION);
    }

    public SessionSettings withRoi(RoiFilter roi) {
        return new SessionSettings(mode, trackTimeoutMs, dedupWindowMs, dedupDistancePx,
                eligibleClassIds, minConfidence, roi, crossingReference);
    }

    public SessionSettings withClasses(Set<Integer> classIds, double minConfidence) {
        return new SessionSettings(mode, trackTimeoutMs, dedupWindowMs, dedupDistancePx,
                classIds, minConfidence, roi, crossingReference);
    }

    public SessionSettings withCrossingReference(CrossingReference ref) {
        return new SessionSettings(mode, trackTimeoutMs, dedupWindowMs, dedupDistancePx,
                eligibleClassIds, minConfidence, roi, ref);
    }

    public SessionSettings withDedup(long windowMs, int distancePx) {
        return new SessionSettings(mode, trackTimeoutMs, windowMs, distancePx,
                eligibleClassIds, minConfidence, roi, crossingReference);
    }

    public SessionSettings withTrackTimeout(long timeoutMs) {
        return new SessionSettings(mode, timeoutMs, dedupWindowMs, dedupDistancePx,
                eligibleClassIds, minConfidence, roi, crossingReference);
    }

    public boolean acceptsClass(int classId) {
        return eligibleClassIds.isEmpty() || eligibleClassIds.contains(classId);
    }
}
