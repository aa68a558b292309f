package com.roadvision.core.source;

import com.roadvision.core.detection.FrameDims;
import com.roadvision.core.detection.RawDetection;

import java.util.List;

/** Детекции одного кадра вместе с его размерами и временем от начала потока. */
public record Frame(long index, long timestampMs, FrameDims dims, List<RawDetection> detections) {

    public Frame {
        detections = detections == null ? List.of() : List.copyOf(detections);
    }
}
