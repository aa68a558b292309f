package com.roadvision.core.counting;

import java.util.List;

/**
 * Результат обработки одного кадра.
 *
 * @param counts      снимок счётчиков после кадра
 * @param annotations подсказки для отрисовки (сначала линии, затем детекции)
 * @param newlyCounted сколько объектов засчитано в этом кадре
 */
public record FrameResult(CountSnapshot counts, List<DrawHint> annotations, int newlyCounted) {

    public FrameResult {
        annotations = List.copyOf(annotations);
    }

    public int total() {
        return counts.total();
    }
}
