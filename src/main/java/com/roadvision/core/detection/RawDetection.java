package com.roadvision.core.detection;

/**
 * Детекция в том виде, в каком её отдал внешний детектор или файл реплея.
 * Любое поле может отсутствовать (null), проверка делается в {@link DetectionValidator}.
 */
public record RawDetection(
        Double x1,
        Double y1,
        Double x2,
        Double y2,
        Double confidence,
        Integer classId,
        Integer trackId     // null или -1, если детектор не удержал идентичность
) {

    public static RawDetection of(double x1, double y1, double x2, double y2,
                                  double confidence, int classId, int trackId) {
        return new RawDetection(x1, y1, x2, y2, confidence, classId, trackId);
    }

    /** Детекция без track id (режим без трекинга). */
    public static RawDetection untracked(double x1, double y1, double x2, double y2,
                                         double confidence, int classId) {
        return new RawDetection(x1, y1, x2, y2, confidence, classId, null);
    }
}
