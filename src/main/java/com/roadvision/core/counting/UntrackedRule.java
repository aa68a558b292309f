package com.roadvision.core.counting;

import java.util.Locale;

/** Как выбрать счётчик для детекции без track id, стоящей в полосе линии. */
public enum UntrackedRule {
    /** всегда направление по умолчанию для линии */
    DEFAULT_DIRECTION,
    /** левее splitRatio·width — leftDirection, правее — противоположное */
    HORIZONTAL_SPLIT;

    public static UntrackedRule parse(String s) {
        if (s == null || s.isBlank()) {
            return DEFAULT_DIRECTION;
        }
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "default", "default_direction" -> DEFAULT_DIRECTION;
            case "horizontal", "horizontal_split" -> HORIZONTAL_SPLIT;
            default -> throw new IllegalArgumentException("Unknown untracked rule: " + s);
        };
    }
}
