package com.roadvision.core.roi;

/**
 * Отсекает полосу marginRatio вдоль каждого края кадра: частично видимые объекты на входе и
 * выходе из кадра дают нестабильный центр.
 */
public final class EdgeMarginRoi implements RoiFilter {
    public static final double DEFAULT_MARGIN_RATIO = 0.05;

    private final double marginRatio;

    public EdgeMarginRoi(double marginRatio) {
        if (Double.isNaN(marginRatio) || marginRatio < 0.0 || marginRatio >= 0.5) {
            throw new IllegalArgumentException("roi margin ratio must be in [0, 0.5): " + marginRatio);
        }
        this.marginRatio = marginRatio;
    }

    public EdgeMarginRoi() {
        this(DEFAULT_MARGIN_RATIO);
    }

    @Override
    public boolean isEligible(int x, int y, int frameWidth, int frameHeight) {
        double mx = frameWidth * marginRatio;
        double my = frameHeight * marginRatio;
        return x >= mx && x <= frameWidth - mx
                && y >= my && y <= frameHeight - my;
    }

    public double marginRatio() {
        return marginRatio;
    }
}
