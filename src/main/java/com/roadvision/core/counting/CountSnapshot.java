package com.roadvision.core.counting;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Неизменяемый снимок счётчиков; итог вычисляется из них же. */
public record CountSnapshot(Map<String, Integer> counters) {

    public static final CountSnapshot EMPTY = new CountSnapshot(Map.of());

    public CountSnapshot {
        counters = Collections.unmodifiableMap(new LinkedHashMap<>(counters));
    }

    public int total() {
        int sum = 0;
        for (int v : counters.values()) {
            sum += v;
        }
        return sum;
    }

    public int get(String name) {
        return counters.getOrDefault(name, 0);
    }
}
