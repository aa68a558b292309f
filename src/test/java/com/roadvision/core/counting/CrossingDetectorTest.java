package com.roadvision.core.counting;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CrossingDetectorTest {

    // высота 480, ratio 0.5 → y=240, полоса [225, 255]
    private static final CountingLine LINE = CountingLine.resolve(new LineSpec("main", 0.5, 15, "down", "up"), 480);

    @Test
    void linePositionIsRoundedFromRatio() {
        assertEquals(240, LINE.positionY());
        assertEquals(225, LINE.upperBound());
        assertEquals(255, LINE.lowerBound());
        assertEquals(72, CountingLine.resolve(new LineSpec("x", 0.15, 5, "a", "b"), 479).positionY()); // 71.85
    }

    @Test
    void jumpAcrossWholeBandDownIsIncreasing() {
        assertEquals(Optional.of(Direction.INCREASING_Y), CrossingDetector.detect(224, 256, LINE));
    }

    @Test
    void jumpAcrossWholeBandUpIsDecreasing() {
        assertEquals(Optional.of(Direction.DECREASING_Y), CrossingDetector.detect(256, 224, LINE));
    }

    @Test
    void movementInsideBandIsNotACrossing() {
        assertTrue(CrossingDetector.detect(226, 254, LINE).isEmpty());
        assertTrue(CrossingDetector.detect(254, 226, LINE).isEmpty());
    }

    @Test
    void bandBoundsAreExclusive() {
        // ровно на границе полосы ещё не "вышел" из неё
        assertTrue(CrossingDetector.detect(225, 256, LINE).isEmpty());
        assertTrue(CrossingDetector.detect(224, 255, LINE).isEmpty());
    }

    @Test
    void unknownPreviousPositionMeansNoCrossing() {
        assertTrue(CrossingDetector.detect(null, 400, LINE).isEmpty());
    }

    @Test
    void sameSideMovementIsNotACrossing() {
        assertTrue(CrossingDetector.detect(100, 200, LINE).isEmpty());
        assertTrue(CrossingDetector.detect(300, 400, LINE).isEmpty());
    }

    @Test
    void zeroToleranceStillNeedsStrictSides() {
        CountingLine thin = CountingLine.resolve(new LineSpec("thin", 0.5, 0, "down", "up"), 100);
        assertEquals(Optional.of(Direction.INCREASING_Y), CrossingDetector.detect(49, 51, thin));
        assertTrue(CrossingDetector.detect(50, 51, thin).isEmpty());
    }
}
