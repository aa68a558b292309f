package com.roadvision.app;

import com.roadvision.core.counting.CountingSession;
import com.roadvision.core.queue.CountingRunner;
import com.roadvision.core.queue.StreamQueueService;
import com.roadvision.core.queue.StreamTask;
import com.roadvision.core.source.FrameClock;
import com.roadvision.ui.CountsFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;

// точка входа: реплей записанных детекций через сессию подсчёта
public final class Boot {
    private static final Logger log = LoggerFactory.getLogger(Boot.class);

    private Boot() {
    }

    public static void main(String[] args) throws Exception {
        Config cfg = Config.load();
        Path detections = detectionsPath(cfg, List.of(args));
        if (detections == null) {
            log.error("No detections file: pass --detections=<file.csv> or -Drv.detections=<file.csv>");
            System.exit(2);
            return;
        }
        if (!Files.isRegularFile(detections)) {
            log.error("Detections file not found: {}", detections.toAbsolutePath());
            System.exit(2);
            return;
        }
        boolean realtime = cfg.replay().realtime()
                || Boolean.getBoolean("rv.realtime")
                || List.of(args).contains("--realtime");

        StreamTask task = run(cfg, detections, realtime);
        log.info("Replay {}: {}", task.status, task.message);
        log.info("Final counts: {}", CountsFormat.formatCounts(task.counts, cfg.display().labels()));
        log.info("Display view: {}", CountsFormat.labelled(task.counts, cfg.display().labels(), cfg.display().totalLabel()));
        if (task.status != StreamTask.Status.DONE) {
            System.exit(1);
        }
    }

    /** Прогнать один файл детекций в фоновом обработчике и дождаться завершения. */
    public static StreamTask run(Config cfg, Path detections, boolean realtime) throws InterruptedException {
        FrameClock clock = new FrameClock();
        CountingSession session = new CountingSession(cfg, clock);
        CountingRunner runner = new CountingRunner(session, clock, realtime);
        runner.addFrameListener(r -> {
            if (r.newlyCounted() > 0) {
                log.info("Counts: {}", CountsFormat.formatCounts(r.counts(), cfg.display().labels()));
            }
        });

        CountDownLatch finished = new CountDownLatch(1);
        try (StreamQueueService queue = new StreamQueueService()) {
            queue.addListener(t -> {
                if (t.isFinished()) finished.countDown();
            });
            StreamTask task = queue.enqueue(detections);
            queue.start(runner);
            finished.await();
            return task;
        }
    }

    private static Path detectionsPath(Config cfg, List<String> args) {
        for (String a : args) {
            if (a.startsWith("--detections=")) {
                return Path.of(a.substring("--detections=".length()));
            }
        }
        String prop = System.getProperty("rv.detections", cfg.replay().detections());
        return prop == null || prop.isBlank() ? null : Path.of(prop);
    }
}
