package com.roadvision.core.counting;

import java.util.Locale;

/** Направление пересечения горизонтальной линии в координатах кадра. */
public enum Direction {
    INCREASING_Y,   // сверху вниз
    DECREASING_Y;   // снизу вверх

    public Direction opposite() {
        return this == INCREASING_Y ? DECREASING_Y : INCREASING_Y;
    }

    /** Разбор значения из конфигурации: "increasing" / "decreasing" (также "increasing_y", "down", "up"). */
    public static Direction parse(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("direction is empty");
        }
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "increasing", "increasing_y", "down" -> INCREASING_Y;
            case "decreasing", "decreasing_y", "up" -> DECREASING_Y;
            default -> throw new IllegalArgumentException("Unknown direction: " + s);
        };
    }
}
