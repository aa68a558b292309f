package com.roadvision.core.counting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Упорядоченный набор линий подсчёта одной сессии.
 *
 * Позиции линий считаются от высоты кадра: сразу в {@link #configure}, либо лениво по первому кадру
 * после {@link #declare}. Методы, меняющие набор, возвращают true, если уже действовавшие позиции
 * изменились: в этом случае история треков обязана быть сброшена вызывающим.
 * Не потокобезопасен, синхронизацию обеспечивает {@link CountingSession}.
 */
public final class LineRegistry {
    private static final Logger log = LoggerFactory.getLogger(LineRegistry.class);

    private List<LineSpec> specs = List.of();
    private List<CountingLine> lines = List.of();
    private int frameHeight = -1;

    /** Задать линии при известной высоте кадра. */
    public boolean configure(int frameHeight, List<LineSpec> specs) {
        if (frameHeight <= 0) {
            throw new IllegalArgumentException("frameHeight must be positive: " + frameHeight);
        }
        List<LineSpec> checked = check(specs);
        return apply(frameHeight, checked);
    }

    /**
     * Задать линии, когда высота кадра ещё неизвестна. Если высота уже зафиксирована прошлым кадром,
     * позиции пересчитываются сразу.
     */
    public boolean declare(List<LineSpec> specs) {
        List<LineSpec> checked = check(specs);
        if (frameHeight > 0) {
            return apply(frameHeight, checked);
        }
        this.specs = checked;
        this.lines = List.of();
        log.info("Counting lines declared: {} (waiting for first frame)", names(checked));
        return false;
    }

    /** Ленивое разрешение по высоте первого кадра; повторные вызовы ничего не меняют. */
    public void resolveIfPending(int frameHeight) {
        if (isResolved() || specs.isEmpty()) {
            return;
        }
        apply(frameHeight, specs);
    }

    public boolean isResolved() {
        return !lines.isEmpty();
    }

    public List<CountingLine> lines() {
        return lines;
    }

    public int frameHeight() {
        return frameHeight;
    }

    /** Имена всех счётчиков в порядке линий. */
    public Set<String> counterNames() {
        Set<String> out = new LinkedHashSet<>();
        for (LineSpec s : specs) {
            out.add(s.increasingName());
            out.add(s.decreasingName());
        }
        return out;
    }

    private boolean apply(int frameHeight, List<LineSpec> newSpecs) {
        List<CountingLine> resolved = new ArrayList<>(newSpecs.size());
        for (LineSpec s : newSpecs) {
            resolved.add(CountingLine.resolve(s, frameHeight));
        }
        boolean wasResolved = isResolved();
        boolean changed = wasResolved && !resolved.equals(lines);
        this.specs = newSpecs;
        this.lines = List.copyOf(resolved);
        this.frameHeight = frameHeight;
        if (!wasResolved || changed) {
            for (CountingLine l : this.lines) {
                log.info("Counting line '{}' at y={} (ratio={}, tolerance={}px, frameHeight={})",
                        l.name(), l.positionY(), l.spec().ratio(), l.tolerance(), frameHeight);
            }
        }
        return changed;
    }

    private static List<LineSpec> check(List<LineSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new IllegalArgumentException("at least one counting line is required");
        }
        Set<String> seen = new HashSet<>();
        for (LineSpec s : specs) {
            if (s == null) {
                throw new IllegalArgumentException("line spec is null");
            }
            if (!seen.add(s.name())) {
                throw new IllegalArgumentException("duplicate line name: " + s.name());
            }
        }
        return List.copyOf(specs);
    }

    private static List<String> names(List<LineSpec> specs) {
        return specs.stream().map(LineSpec::name).toList();
    }
}
