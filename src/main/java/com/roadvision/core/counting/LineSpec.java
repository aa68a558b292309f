package com.roadvision.core.counting;

/**
 * Описание линии подсчёта до того, как известна высота кадра.
 *
 * @param name            имя линии (уникально в сессии)
 * @param ratio           положение линии как доля высоты кадра, [0,1]
 * @param tolerance       полуширина полосы допуска в пикселях
 * @param increasingName  счётчик для движения вниз (y растёт)
 * @param decreasingName  счётчик для движения вверх (y убывает)
 * @param untrackedRule   правило выбора счётчика в режиме без трекинга
 * @param defaultDirection направление для {@link UntrackedRule#DEFAULT_DIRECTION}
 * @param splitRatio      граница по x (доля ширины) для {@link UntrackedRule#HORIZONTAL_SPLIT}
 * @param leftDirection   направление левее границы для {@link UntrackedRule#HORIZONTAL_SPLIT}
 */
public record LineSpec(
        String name,
        double ratio,
        int tolerance,
        String increasingName,
        String decreasingName,
        UntrackedRule untrackedRule,
        Direction defaultDirection,
        double splitRatio,
        Direction leftDirection
) {
    public static final int DEFAULT_TOLERANCE = 15;

    // не зажимаем значения: ошибка вызывающего должна быть видна сразу
    public LineSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("line name is required");
        }
        if (Double.isNaN(ratio) || ratio < 0.0 || ratio > 1.0) {
            throw new IllegalArgumentException("line '" + name + "': ratio must be in [0,1], got " + ratio);
        }
        if (tolerance < 0) {
            throw new IllegalArgumentException("line '" + name + "': tolerance must be >= 0, got " + tolerance);
        }
        if (increasingName == null || increasingName.isBlank()
                || decreasingName == null || decreasingName.isBlank()) {
            throw new IllegalArgumentException("line '" + name + "': both counter names are required");
        }
        if (Double.isNaN(splitRatio) || splitRatio < 0.0 || splitRatio > 1.0) {
            throw new IllegalArgumentException("line '" + name + "': splitRatio must be in [0,1], got " + splitRatio);
        }
        if (untrackedRule == null) untrackedRule = UntrackedRule.DEFAULT_DIRECTION;
        if (defaultDirection == null) defaultDirection = Direction.INCREASING_Y;
        if (leftDirection == null) leftDirection = Direction.DECREASING_Y;
    }

    /** Упрощённый конструктор: правило по умолчанию, направление "вниз". */
    public LineSpec(String name, double ratio, int tolerance, String increasingName, String decreasingName) {
        this(name, ratio, tolerance, increasingName, decreasingName,
                UntrackedRule.DEFAULT_DIRECTION, Direction.INCREASING_Y, 0.5, Direction.DECREASING_Y);
    }

    public String counterFor(Direction d) {
        return d == Direction.INCREASING_Y ? increasingName : decreasingName;
    }
}
