package com.roadvision.core.counting;

import com.roadvision.core.detection.Detection;

import java.util.Locale;

/**
 * Подсказка для слоя отображения: линия с полосой допуска или бокс детекции.
 * Слой отображения рисует по этим данным и не повторяет логику подсчёта.
 */
public record DrawHint(
        Kind kind,
        int x1,
        int y1,
        int x2,
        int y2,
        String label,
        int trackId,        // для LINE всегда -1
        boolean counted,    // трек уже посчитан (или детекция засчитана в этом кадре)
        boolean eligible,   // прошла фильтр ROI/классов
        int tolerance       // для DETECTION всегда 0
) {
    public enum Kind { LINE, DETECTION }

    public static DrawHint line(CountingLine line, int frameWidth) {
        return new DrawHint(Kind.LINE, 0, line.positionY(), frameWidth, line.positionY(),
                line.name(), Detection.NO_TRACK, false, true, line.tolerance());
    }

    public static DrawHint detection(Detection d, boolean counted, boolean eligible) {
        return new DrawHint(Kind.DETECTION, d.x1(), d.y1(), d.x2(), d.y2(),
                label(d), d.trackId(), counted, eligible, 0);
    }

    // "ID:7 0.91" для трека, "Car 0.91" без идентичности, как в исходной подписи
    static String label(Detection d) {
        return d.hasTrack()
                ? String.format(Locale.ROOT, "ID:%d %.2f", d.trackId(), d.confidence())
                : String.format(Locale.ROOT, "Car %.2f", d.confidence());
    }
}
