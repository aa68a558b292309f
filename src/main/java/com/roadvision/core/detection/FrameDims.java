package com.roadvision.core.detection;

public record FrameDims(int width, int height) {

    public FrameDims {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame dims must be positive: " + width + "x" + height);
        }
    }
}
