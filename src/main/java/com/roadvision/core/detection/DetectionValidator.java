package com.roadvision.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Граница приёма детекций: всё, что нарушает контракт детектора,
 * отбрасывается здесь и логируется, дальше по конвейеру идут только {@link Detection}.
 */
public final class DetectionValidator {
    private static final Logger log = LoggerFactory.getLogger(DetectionValidator.class);

    static final int MIN_COORD = Integer.MIN_VALUE / 2;
    static final int MAX_COORD = Integer.MAX_VALUE / 2;

    private DetectionValidator() {
        // no-op
    }

    public static Optional<Detection> validate(RawDetection raw) {
        if (raw == null) {
            log.warn("Skip detection: null");
            return Optional.empty();
        }
        if (!finite(raw.x1()) || !finite(raw.y1()) || !finite(raw.x2()) || !finite(raw.y2())) {
            log.warn("Skip detection without box: {}", raw);
            return Optional.empty();
        }
        if (!inRange(raw.x1()) || !inRange(raw.y1()) || !inRange(raw.x2()) || !inRange(raw.y2())) {
            log.warn("Skip detection with out-of-range box: {}", raw);
            return Optional.empty();
        }
        if (raw.confidence() == null || !(raw.confidence() >= 0.0 && raw.confidence() <= 1.0)) {
            log.warn("Skip detection with bad confidence: {}", raw);
            return Optional.empty();
        }
        int x1 = (int) Math.round(raw.x1());
        int y1 = (int) Math.round(raw.y1());
        int x2 = (int) Math.round(raw.x2());
        int y2 = (int) Math.round(raw.y2());
        if (x2 < x1 || y2 < y1) {
            log.warn("Skip detection with inverted box: {}", raw);
            return Optional.empty();
        }
        int classId = raw.classId() == null ? -1 : raw.classId();
        int trackId = raw.trackId() == null ? Detection.NO_TRACK : raw.trackId();
        return Optional.of(new Detection(x1, y1, x2, y2, raw.confidence(), classId, trackId));
    }

    /** Проверить весь кадр; плохие детекции пропускаются, остальные сохраняют порядок. */
    public static List<Detection> validateAll(List<RawDetection> raws) {
        if (raws == null || raws.isEmpty()) {
            return List.of();
        }
        List<Detection> out = new ArrayList<>(raws.size());
        for (RawDetection r : raws) {
            validate(r).ifPresent(out::add);
        }
        return out;
    }

    private static boolean finite(Double v) {
        return v != null && Double.isFinite(v);
    }

    // половина диапазона int: сумма двух координат для центра не переполняется
    private static boolean inRange(double v) {
        return v >= MIN_COORD && v <= MAX_COORD;
    }
}
