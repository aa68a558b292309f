package com.roadvision.core.detection;

/**
 * Проверенная детекция одного объекта в одном кадре.
 * Координаты в пикселях кадра, (x1,y1) левый верхний угол.
 */
public record Detection(
        int x1,
        int y1,
        int x2,
        int y2,
        double confidence,
        int classId,        // -1, если класс неизвестен
        int trackId         // NO_TRACK, если идентичности нет
) {
    public static final int NO_TRACK = -1;

    public Detection {
        if (x2 < x1 || y2 < y1) {
            throw new IllegalArgumentException("Invalid box: (" + x1 + "," + y1 + ")-(" + x2 + "," + y2 + ")");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be in [0,1]: " + confidence);
        }
        if (trackId < 0) {
            trackId = NO_TRACK;
        }
    }

    public boolean hasTrack() {
        return trackId != NO_TRACK;
    }

    // целочисленный центр, как и в исходном счётчике
    public int centerX() {
        return (int) Math.floorDiv((long) x1 + x2, 2L);
    }

    public int centerY() {
        return (int) Math.floorDiv((long) y1 + y2, 2L);
    }
}
