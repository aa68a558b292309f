package com.roadvision.core.counting;

import java.util.Optional;

/**
 * Решение о пересечении линии по двум последовательным позициям трека.
 * Пересечение засчитывается, только если трек вышел за обе границы полосы допуска:
 * дрожание внутри полосы пересечением не считается.
 */
public final class CrossingDetector {

    private CrossingDetector() {
        // no-op
    }

    public static Optional<Direction> detect(Integer previousY, int currentY, CountingLine line) {
        if (previousY == null) {
            return Optional.empty();
        }
        int prev = previousY;
        if (prev < line.upperBound() && currentY > line.lowerBound()) {
            return Optional.of(Direction.INCREASING_Y);
        }
        if (prev > line.lowerBound() && currentY < line.upperBound()) {
            return Optional.of(Direction.DECREASING_Y);
        }
        return Optional.empty();
    }
}
