package com.roadvision.ui;

import com.roadvision.core.counting.CountSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Текстовое представление счётчиков для лога и внешнего слоя отображения.
 * Метки позволяют показывать направления под именами пунктов назначения (down → "jakarta").
 */
public class CountsFormat {

    public static final String TOTAL = "total";

    private CountsFormat() {
        // no-op
    }

    /** "total=3 | down=2 | up=1"; имя счётчика заменяется меткой, если она задана. */
    public static String formatCounts(CountSnapshot counts, Map<String, String> labels) {
        StringBuilder sb = new StringBuilder();
        sb.append(TOTAL).append('=').append(counts.total());
        for (Map.Entry<String, Integer> e : counts.counters().entrySet()) {
            sb.append(" | ").append(label(e.getKey(), labels)).append('=').append(e.getValue());
        }
        return sb.toString();
    }

    /**
     * Плоская карта для отображения: итог под ключом totalLabel, затем счётчики под своими метками.
     * Если две метки совпали, значения складываются.
     */
    public static Map<String, Integer> labelled(CountSnapshot counts, Map<String, String> labels, String totalLabel) {
        Map<String, Integer> out = new LinkedHashMap<>();
        out.put(totalLabel == null || totalLabel.isBlank() ? TOTAL : totalLabel, counts.total());
        counts.counters().forEach((k, v) -> out.merge(label(k, labels), v, Integer::sum));
        return out;
    }

    private static String label(String counter, Map<String, String> labels) {
        if (labels == null) return counter;
        String l = labels.get(counter);
        return l == null || l.isBlank() ? counter : l;
    }
}
