package com.roadvision.core.queue;

import com.roadvision.core.counting.CountSnapshot;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StreamQueueServiceTest {

    @Test
    void processesTaskAndReportsProgress() throws Exception {
        CountSnapshot result = new CountSnapshot(Map.of("down", 2, "up", 1));
        List<Integer> progress = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        try (StreamQueueService q = new StreamQueueService()) {
            q.addListener(t -> {
                if (t.status == StreamTask.Status.RUNNING) progress.add(t.progress);
                if (t.isFinished()) done.countDown();
            });
            StreamTask task = q.enqueue(Path.of("a.csv"));
            q.start((src, onProgress) -> {
                onProgress.accept(50);
                onProgress.accept(150);
                return result;
            });

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(StreamTask.Status.DONE, task.status);
            assertEquals(100, task.progress);
            assertEquals(3, task.counts.total());
            assertNotNull(task.startedAt);
            assertNotNull(task.finishedAt);
        }
        assertTrue(progress.contains(50));
        assertTrue(progress.contains(100));   // 150 прижимается к 100
    }

    @Test
    void failingProcessorMarksTaskFailedAndQueueContinues() throws Exception {
        CountDownLatch done = new CountDownLatch(2);
        try (StreamQueueService q = new StreamQueueService()) {
            q.addListener(t -> {
                if (t.isFinished()) done.countDown();
            });
            StreamTask bad = q.enqueue(Path.of("bad.csv"));
            StreamTask good = q.enqueue(Path.of("good.csv"));
            q.start((src, onProgress) -> {
                if (src.endsWith("bad.csv")) throw new IllegalStateException("broken stream");
                return CountSnapshot.EMPTY;
            });

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(StreamTask.Status.FAILED, bad.status);
            assertEquals("broken stream", bad.message);
            assertEquals(StreamTask.Status.DONE, good.status);
        }
    }

    @Test
    void errorFromProcessorFailsTaskAndNextTaskStillRuns() throws Exception {
        CountDownLatch done = new CountDownLatch(2);
        try (StreamQueueService q = new StreamQueueService()) {
            q.addListener(t -> {
                if (t.isFinished()) done.countDown();
            });
            StreamTask first = q.enqueue(Path.of("first.csv"));
            StreamTask second = q.enqueue(Path.of("second.csv"));
            q.start((src, onProgress) -> {
                if (src.endsWith("first.csv")) throw new AssertionError("decoder state corrupted");
                return new CountSnapshot(Map.of("down", 1));
            });

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(StreamTask.Status.FAILED, first.status);
            assertEquals("decoder state corrupted", first.message);
            assertNotNull(first.finishedAt);
            assertEquals(StreamTask.Status.DONE, second.status);
            assertEquals(1, second.counts.total());
        }
    }

    @Test
    void cancelPendingTask() {
        try (StreamQueueService q = new StreamQueueService()) {
            StreamTask t = q.enqueue(Path.of("later.csv"));
            assertEquals(1, q.snapshot().size());

            assertTrue(q.cancel(t));

            assertEquals(StreamTask.Status.CANCELED, t.status);
            assertTrue(t.isFinished());
            assertTrue(q.snapshot().isEmpty());
            assertFalse(q.cancel(t));
        }
    }

    @Test
    void brokenListenerDoesNotStopQueue() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        try (StreamQueueService q = new StreamQueueService()) {
            q.addListener(t -> {
                throw new RuntimeException("listener bug");
            });
            q.addListener(t -> {
                if (t.isFinished()) done.countDown();
            });
            StreamTask t = q.enqueue(Path.of("a.csv"));
            q.start((src, onProgress) -> CountSnapshot.EMPTY);

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(StreamTask.Status.DONE, t.status);
        }
    }
}
