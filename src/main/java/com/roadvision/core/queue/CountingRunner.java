package com.roadvision.core.queue;

import com.roadvision.core.counting.CountSnapshot;
import com.roadvision.core.counting.CountingSession;
import com.roadvision.core.counting.FrameResult;
import com.roadvision.core.source.CsvFrameSource;
import com.roadvision.core.source.Frame;
import com.roadvision.core.source.FrameClock;
import com.roadvision.core.source.FrameSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Прогоняет поток кадров через сессию подсчёта: пауза/продолжение, остановка, сброс счётчика,
 * опциональный темп реального времени по меткам кадров.
 */
public final class CountingRunner implements StreamQueueService.Processor {
    private static final Logger log = LoggerFactory.getLogger(CountingRunner.class);

    private static final long PAUSE_POLL_MS = 50;

    private final CountingSession session;
    private final FrameClock frameClock;   // null: сессия живёт по своим часам
    private final boolean realtime;
    private final CopyOnWriteArrayList<Consumer<FrameResult>> frameListeners = new CopyOnWriteArrayList<>();

    private volatile boolean paused = false;
    private volatile boolean stopRequested = false;

    public CountingRunner(CountingSession session, FrameClock frameClock, boolean realtime) {
        this.session = Objects.requireNonNull(session, "session");
        this.frameClock = frameClock;
        this.realtime = realtime;
    }

    public void addFrameListener(Consumer<FrameResult> l) {
        if (l != null) frameListeners.add(l);
    }

    public boolean togglePause() {
        paused = !paused;
        log.info(paused ? "Paused" : "Resumed");
        return paused;
    }

    public boolean isPaused() {
        return paused;
    }

    /** Прервать текущий поток после текущего кадра. */
    public void stop() {
        stopRequested = true;
        paused = false;
    }

    /** Сброс проходит через блокировку сессии, можно звать из любого потока. */
    public void resetCounter() {
        session.reset();
    }

    @Override
    public CountSnapshot process(Path source, Consumer<Integer> onProgress) throws Exception {
        try (CsvFrameSource src = new CsvFrameSource(source)) {
            log.info("Replay {} ({} frames)", source, src.totalFrames());
            return run(src, onProgress);
        }
    }

    /** Прогнать источник до конца, до stop() или до прерывания потока. */
    public CountSnapshot run(FrameSource src, Consumer<Integer> onProgress) throws Exception {
        stopRequested = false;
        long total = src.totalFrames();
        long done = 0;
        Long prevTs = null;
        while (!stopRequested) {
            while (paused && !stopRequested) {
                Thread.sleep(PAUSE_POLL_MS);
            }
            if (stopRequested) break;
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("stream interrupted");
            }

            Optional<Frame> next = src.next();
            if (next.isEmpty()) {
                log.info("End of stream after {} frames", done);
                break;
            }
            Frame f = next.get();
            if (realtime && prevTs != null && f.timestampMs() > prevTs) {
                Thread.sleep(f.timestampMs() - prevTs);
            }
            prevTs = f.timestampMs();
            if (frameClock != null) {
                frameClock.set(f.timestampMs());
            }

            FrameResult r = session.process(f.detections(), f.dims());
            for (Consumer<FrameResult> l : frameListeners) {
                l.accept(r);
            }
            done++;
            if (onProgress != null && total > 0) {
                onProgress.accept((int) (done * 100 / total));
            }
        }
        if (stopRequested) {
            log.info("Stopped after {} frames", done);
        }
        return session.getCounts();
    }
}
