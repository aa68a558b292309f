package com.roadvision.core.counting;

/** Линия с вычисленной позицией в пикселях; неизменяема. */
public record CountingLine(LineSpec spec, int positionY) {

    public String name() {
        return spec.name();
    }

    public int tolerance() {
        return spec.tolerance();
    }

    public int upperBound() {
        return positionY - spec.tolerance();
    }

    public int lowerBound() {
        return positionY + spec.tolerance();
    }

    /** Центр сейчас внутри полосы допуска (границы включительно). */
    public boolean inBand(int y) {
        return Math.abs(y - positionY) <= spec.tolerance();
    }

    public String counterFor(Direction d) {
        return spec.counterFor(d);
    }

    static CountingLine resolve(LineSpec spec, int frameHeight) {
        return new CountingLine(spec, (int) Math.round(frameHeight * spec.ratio()));
    }
}
