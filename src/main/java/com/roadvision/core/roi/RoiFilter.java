package com.roadvision.core.roi;

/** Какие точки кадра допускаются к проверке пересечения. Проверяется центр детекции. */
@FunctionalInterface
public interface RoiFilter {

    boolean isEligible(int x, int y, int frameWidth, int frameHeight);

    /** Весь кадр. */
    RoiFilter ALL = (x, y, w, h) -> true;
}
