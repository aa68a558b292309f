package com.roadvision.core.queue;

import com.roadvision.core.counting.CountSnapshot;
import com.roadvision.core.counting.CountingMode;
import com.roadvision.core.counting.CountingSession;
import com.roadvision.core.counting.LineSpec;
import com.roadvision.core.counting.SessionSettings;
import com.roadvision.core.detection.FrameDims;
import com.roadvision.core.detection.RawDetection;
import com.roadvision.core.source.Frame;
import com.roadvision.core.source.FrameClock;
import com.roadvision.core.source.FrameSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CountingRunnerTest {

    private static final FrameDims DIMS = new FrameDims(640, 480);

    private FrameClock clock;
    private CountingSession session;

    /** Источник в памяти: заранее заданный список кадров. */
    private static final class ListSource implements FrameSource {
        private final Deque<Frame> frames;
        private final long total;
        boolean closed = false;

        ListSource(List<Frame> frames) {
            this.frames = new ArrayDeque<>(frames);
            this.total = frames.size();
        }

        @Override
        public Optional<Frame> next() {
            return Optional.ofNullable(frames.poll());
        }

        @Override
        public long totalFrames() {
            return total;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @BeforeEach
    void setUp() {
        clock = new FrameClock();
        session = new CountingSession(SessionSettings.defaults(CountingMode.TRACKED), clock);
        session.declare(List.of(new LineSpec("main", 0.5, 15, "down", "up")));
    }

    private static Frame frame(long idx, long tMs, RawDetection... dets) {
        return new Frame(idx, tMs, DIMS, List.of(dets));
    }

    private static RawDetection car(int track, int cy) {
        return RawDetection.of(300, cy - 20, 340, cy + 20, 0.8, 2, track);
    }

    // трек 1 идёт вниз через линию 240, трек 2 вверх
    private static List<Frame> twoWay() {
        return List.of(
                frame(0, 0, car(1, 200), car(2, 300)),
                frame(1, 40, car(1, 270), car(2, 210)),
                frame(2, 80, car(1, 300)),
                frame(3, 120));
    }

    @Test
    void countsWholeStreamAndReportsProgress() throws Exception {
        CountingRunner runner = new CountingRunner(session, clock, false);
        List<Integer> progress = new ArrayList<>();

        CountSnapshot counts = runner.run(new ListSource(twoWay()), progress::add);

        assertEquals(1, counts.get("down"));
        assertEquals(1, counts.get("up"));
        assertEquals(List.of(25, 50, 75, 100), progress);
        assertEquals(120, clock.millis());
    }

    @Test
    void frameListenersSeeEveryFrame() throws Exception {
        CountingRunner runner = new CountingRunner(session, clock, false);
        AtomicInteger frames = new AtomicInteger();
        AtomicInteger counted = new AtomicInteger();
        runner.addFrameListener(r -> {
            frames.incrementAndGet();
            counted.addAndGet(r.newlyCounted());
        });

        runner.run(new ListSource(twoWay()), null);

        assertEquals(4, frames.get());
        assertEquals(2, counted.get());
    }

    @Test
    void stopEndsStreamAfterCurrentFrame() throws Exception {
        CountingRunner runner = new CountingRunner(session, clock, false);
        AtomicInteger frames = new AtomicInteger();
        runner.addFrameListener(r -> {
            frames.incrementAndGet();
            runner.stop();
        });

        CountSnapshot counts = runner.run(new ListSource(twoWay()), null);

        assertEquals(1, frames.get());
        assertEquals(0, counts.total());
    }

    @Test
    void resetDuringStreamStartsFromZero() throws Exception {
        CountingRunner runner = new CountingRunner(session, clock, false);
        runner.addFrameListener(r -> {
            if (r.newlyCounted() > 0) runner.resetCounter();
        });

        CountSnapshot counts = runner.run(new ListSource(twoWay()), null);

        assertEquals(0, counts.total());
        assertEquals(1, session.activeTracks());
    }

    @Test
    @Timeout(5)
    void pausedRunnerWaitsUntilResumed() throws Exception {
        CountingRunner runner = new CountingRunner(session, clock, false);
        assertTrue(runner.togglePause());
        AtomicInteger frames = new AtomicInteger();
        runner.addFrameListener(r -> frames.incrementAndGet());

        Thread resumer = new Thread(() -> {
            try {
                Thread.sleep(150);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            runner.togglePause();
        });
        resumer.start();
        CountSnapshot counts = runner.run(new ListSource(twoWay()), null);
        resumer.join();

        assertFalse(runner.isPaused());
        assertEquals(4, frames.get());
        assertEquals(2, counts.total());
    }

    @Test
    @Timeout(5)
    void stopWhilePausedReturnsWithoutFrames() throws Exception {
        CountingRunner runner = new CountingRunner(session, clock, false);
        runner.togglePause();
        AtomicInteger frames = new AtomicInteger();
        runner.addFrameListener(r -> frames.incrementAndGet());

        Thread stopper = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            runner.stop();
        });
        stopper.start();
        runner.run(new ListSource(twoWay()), null);
        stopper.join();

        assertEquals(0, frames.get());
    }

    @Test
    void processReadsReplayFile() throws Exception {
        CountingRunner runner = new CountingRunner(
                new CountingSession(SessionSettings.defaults(CountingMode.TRACKED), clock), clock, false);
        // линии не заданы: сессия обязана отказать, обработчик пробрасывает ошибку
        Path p = Path.of(getClass().getResource("/replay/two_way.csv").toURI());

        assertThrows(IllegalStateException.class, () -> runner.process(p, null));
    }
}
