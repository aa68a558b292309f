package com.roadvision.core.counting;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Именованные счётчики. Итог не хранится отдельно: {@link #total()} всегда сумма счётчиков.
 */
public final class Counters {
    private final Map<String, Integer> values = new LinkedHashMap<>();

    /** Зарегистрировать имена, чтобы они попадали в снимок даже с нулём. */
    public void register(Collection<String> names) {
        for (String n : names) {
            values.putIfAbsent(n, 0);
        }
    }

    public int increment(String name) {
        return values.merge(name, 1, Integer::sum);
    }

    public int get(String name) {
        return values.getOrDefault(name, 0);
    }

    public int total() {
        int sum = 0;
        for (int v : values.values()) {
            sum += v;
        }
        return sum;
    }

    /** Обнулить все счётчики, имена сохраняются. */
    public void zero() {
        values.replaceAll((k, v) -> 0);
    }

    public CountSnapshot snapshot() {
        return new CountSnapshot(values);
    }
}
