package com.roadvision.core.counting;

import com.roadvision.app.Config;
import com.roadvision.core.detection.Detection;
import com.roadvision.core.detection.DetectionValidator;
import com.roadvision.core.detection.FrameDims;
import com.roadvision.core.detection.RawDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Сессия подсчёта: линии, треки, журнал событий и счётчики одного потока кадров.
 *
 * Порядок на кадр: вытеснение устаревших треков → проверка детекций → фильтр классов и ROI →
 * обновление трека → проверка пересечения → счётчики. Все публичные операции выполняются под
 * одной блокировкой, поэтому {@link #reset()} никогда не попадает в середину кадра.
 * Сообщения о засчитанных машинах копятся за кадр и пишутся в лог уже после снятия блокировки.
 */
public final class CountingSession {
    private static final Logger log = LoggerFactory.getLogger(CountingSession.class);

    private final SessionSettings settings;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final LineRegistry registry = new LineRegistry();
    private final TrackStateStore tracks = new TrackStateStore();
    private final EventLedger ledger;
    private final Counters counters = new Counters();

    private long frames = 0;

    // засчитанная машина; trackId = -1 в режиме без трекинга
    private record Counted(int trackId, String line, String counter, int value, int total, int x) {}

    public CountingSession(SessionSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ledger = new EventLedger(settings.dedupWindowMs(), settings.dedupDistancePx());
        log.info("Counting session: mode={}, crossing={}, trackTimeoutMs={}, dedupWindowMs={}, dedupDistancePx={}, classes={}, minConfidence={}",
                settings.mode(), settings.crossingReference(), settings.trackTimeoutMs(), settings.dedupWindowMs(),
                settings.dedupDistancePx(), settings.eligibleClassIds().isEmpty() ? "all" : settings.eligibleClassIds(),
                settings.minConfidence());
    }

    /** Удобный конструктор: параметры и линии из application.yaml, высота кадра берётся из первого кадра. */
    public CountingSession(Config cfg, Clock clock) {
        this(cfg.resolveCounting(), clock);
    }

    private CountingSession(Config.Resolved resolved, Clock clock) {
        this(resolved.settings(), clock);
        declare(resolved.lines());
    }

    /** Задать линии при известной высоте кадра. Повтор с теми же параметрами ничего не меняет. */
    public void configure(int frameHeight, List<LineSpec> specs) {
        lock.lock();
        try {
            boolean moved = registry.configure(frameHeight, specs);
            afterLinesChanged(moved);
        } finally {
            lock.unlock();
        }
    }

    /** Задать линии до первого кадра: позиции будут вычислены по его высоте. */
    public void declare(List<LineSpec> specs) {
        lock.lock();
        try {
            boolean moved = registry.declare(specs);
            afterLinesChanged(moved);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Обработать детекции одного кадра.
     *
     * @throws IllegalStateException если линии не заданы
     */
    public FrameResult process(List<RawDetection> detections, FrameDims dims) {
        Objects.requireNonNull(dims, "dims");
        List<Counted> countedNow = new ArrayList<>();
        FrameResult result;
        lock.lock();
        try {
            if (!registry.isResolved()) {
                registry.resolveIfPending(dims.height());
                if (!registry.isResolved()) {
                    throw new IllegalStateException("counting lines are not configured");
                }
                counters.register(registry.counterNames());
            }
            long now = clock.millis();
            frames++;

            // вытеснение до обновления: вернувшийся после таймаута id должен начать с нуля
            int evicted = tracks.evictStale(now, settings.trackTimeoutMs());
            int pruned = ledger.prune(now);
            if (evicted > 0 || pruned > 0) {
                log.debug("frame {}: evicted {} tracks, pruned {} events", frames, evicted, pruned);
            }

            List<CountingLine> lines = registry.lines();
            List<DrawHint> hints = new ArrayList<>();
            for (CountingLine l : lines) {
                hints.add(DrawHint.line(l, dims.width()));
            }

            int newly = 0;
            for (Detection d : DetectionValidator.validateAll(detections)) {
                if (!isEligible(d, dims)) {
                    hints.add(DrawHint.detection(d, d.hasTrack() && tracks.isCounted(d.trackId()), false));
                    continue;
                }
                boolean counted = switch (settings.mode()) {
                    case TRACKED -> countTracked(d, lines, now, countedNow);
                    case UNTRACKED -> countUntracked(d, lines, dims, now, countedNow);
                };
                if (counted) newly++;
                boolean showCounted = settings.mode() == CountingMode.TRACKED
                        ? d.hasTrack() && tracks.isCounted(d.trackId())
                        : counted;
                hints.add(DrawHint.detection(d, showCounted, true));
            }
            result = new FrameResult(counters.snapshot(), hints, newly);
        } finally {
            lock.unlock();
        }
        for (Counted c : countedNow) {
            if (c.trackId() >= 0) {
                log.info("Vehicle ID:{} counted going {} at line '{}' ({}={}, total={})",
                        c.trackId(), c.counter(), c.line(), c.counter(), c.value(), c.total());
            } else {
                log.info("Untracked vehicle counted going {} at line '{}' x={} ({}={}, total={})",
                        c.counter(), c.line(), c.x(), c.counter(), c.value(), c.total());
            }
        }
        return result;
    }

    /** Обнулить счётчики, очистить треки и журнал событий одной операцией. */
    public void reset() {
        lock.lock();
        try {
            counters.zero();
            tracks.clear();
            ledger.clear();
        } finally {
            lock.unlock();
        }
        log.info("Counter reset");
    }

    public CountSnapshot getCounts() {
        lock.lock();
        try {
            return counters.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public int activeTracks() {
        lock.lock();
        try {
            return tracks.size();
        } finally {
            lock.unlock();
        }
    }

    /** Состояние трека или empty, если трек не известен (не появлялся, вытеснен, сброшен). */
    public Optional<TrackState> track(int trackId) {
        lock.lock();
        try {
            return Optional.ofNullable(tracks.get(trackId));
        } finally {
            lock.unlock();
        }
    }

    public List<CountingLine> lines() {
        lock.lock();
        try {
            return registry.lines();
        } finally {
            lock.unlock();
        }
    }

    boolean lockHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public SessionSettings settings() {
        return settings;
    }

    private boolean isEligible(Detection d, FrameDims dims) {
        if (!settings.acceptsClass(d.classId()) || d.confidence() < settings.minConfidence()) {
            return false;
        }
        return settings.roi().isEligible(d.centerX(), d.centerY(), dims.width(), dims.height());
    }

    // один счёт на трек за всю его жизнь, на какой бы линии он ни случился
    private boolean countTracked(Detection d, List<CountingLine> lines, long now, List<Counted> out) {
        if (!d.hasTrack()) {
            return false;
        }
        Center center = new Center(d.centerX(), d.centerY());
        Center prev = tracks.upsert(d.trackId(), center, now);
        TrackState st = tracks.get(d.trackId());
        boolean counted = false;
        if (prev != null && !st.counted()) {
            for (CountingLine line : lines) {
                Integer ref = settings.crossingReference() == CrossingReference.PREVIOUS_POSITION
                        ? Integer.valueOf(prev.y())
                        : st.lastOutsideY(line.name());
                Optional<Direction> dir = CrossingDetector.detect(ref, center.y(), line);
                if (dir.isPresent()) {
                    String name = line.counterFor(dir.get());
                    int value = counters.increment(name);
                    tracks.markCounted(d.trackId(), name);
                    out.add(new Counted(d.trackId(), line.name(), name, value, counters.total(), center.x()));
                    counted = true;
                    break;
                }
            }
        }
        st.noteOutside(lines, center.y());
        return counted;
    }

    private boolean countUntracked(Detection d, List<CountingLine> lines, FrameDims dims, long now,
                                   List<Counted> out) {
        Center center = new Center(d.centerX(), d.centerY());
        for (CountingLine line : lines) {
            if (!line.inBand(center.y())) {
                continue;
            }
            if (ledger.isDuplicate(line.name(), center, now)) {
                log.debug("Suppressed duplicate near line '{}' at {}", line.name(), center);
                return false;
            }
            String name = line.counterFor(untrackedDirection(line, center, dims));
            int value = counters.increment(name);
            ledger.append(new CrossingEvent(now, center, line.name(), name));
            out.add(new Counted(Detection.NO_TRACK, line.name(), name, value, counters.total(), center.x()));
            return true;
        }
        return false;
    }

    private static Direction untrackedDirection(CountingLine line, Center c, FrameDims dims) {
        LineSpec s = line.spec();
        return switch (s.untrackedRule()) {
            case DEFAULT_DIRECTION -> s.defaultDirection();
            case HORIZONTAL_SPLIT -> c.x() < dims.width() * s.splitRatio()
                    ? s.leftDirection()
                    : s.leftDirection().opposite();
        };
    }

    private void afterLinesChanged(boolean moved) {
        if (registry.isResolved()) {
            counters.register(registry.counterNames());
        }
        if (moved) {
            int dropped = tracks.size();
            tracks.clear();
            ledger.clear();
            log.warn("Counting lines moved: dropped {} tracks and event history", dropped);
        }
    }
}
