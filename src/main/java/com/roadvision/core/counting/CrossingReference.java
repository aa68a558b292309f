package com.roadvision.core.counting;

import java.util.Locale;

/** С какой прошлой позицией трека сравнивается текущая при проверке пересечения. */
public enum CrossingReference {
    /** позиция из предыдущего обновления трека: полосу надо перескочить за одно обновление */
    PREVIOUS_POSITION,
    /**
     * последняя позиция трека вне полосы этой линии: медленный объект, проходящий полосу
     * за несколько кадров, тоже засчитывается, дрожание внутри полосы по-прежнему нет
     */
    LAST_OUTSIDE_BAND;

    public static CrossingReference parse(String s) {
        if (s == null || s.isBlank()) {
            return PREVIOUS_POSITION;
        }
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "previous", "previous_position" -> PREVIOUS_POSITION;
            case "band_exit", "last_outside_band" -> LAST_OUTSIDE_BAND;
            default -> throw new IllegalArgumentException("Unknown crossing reference: " + s);
        };
    }
}
