package com.roadvision.core.counting;

import java.util.Locale;

/** Режим подсчёта, выбирается на всю сессию. */
public enum CountingMode {
    /** есть устойчивые track id: один счёт на трек */
    TRACKED,
    /** track id нет: близость к линии + дедупликация по времени и месту */
    UNTRACKED;

    public static CountingMode parse(String s) {
        if (s == null || s.isBlank()) {
            return TRACKED;
        }
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "tracked" -> TRACKED;
            case "untracked", "fallback" -> UNTRACKED;
            default -> throw new IllegalArgumentException("Unknown counting mode: " + s);
        };
    }
}
