package com.roadvision.core.queue;

import com.roadvision.core.counting.CountSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Очередь файлов/потоков детекций с одним фоновым обработчиком "rv-stream-worker".
 * Потоки идут строго по одному: сессия подсчёта всегда получает кадры от одного писателя.
 * Слушатели получают каждое изменение статуса; прогресс сообщается только при смене процента.
 */
public final class StreamQueueService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StreamQueueService.class);

    private static final long POLL_MS = 250;

    /** Обрабатывает один поток и возвращает итоговые счётчики. При сбое бросает исключение. */
    @FunctionalInterface
    public interface Processor {
        CountSnapshot process(Path source, Consumer<Integer> onProgress) throws Exception;
    }

    /** Подписчик на изменения задач (например, слой отображения). */
    @FunctionalInterface
    public interface Listener {
        void onUpdate(StreamTask task);
    }

    private final BlockingQueue<StreamTask> pending = new LinkedBlockingQueue<>();
    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "rv-stream-worker");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean running = false;
    private Future<?> loop;

    public void addListener(Listener l) {
        if (l != null) listeners.add(l);
    }

    public void removeListener(Listener l) {
        listeners.remove(l);
    }

    /** Задачи, ещё не взятые в работу. */
    public List<StreamTask> snapshot() {
        return List.copyOf(pending);
    }

    public StreamTask enqueue(Path source) {
        Objects.requireNonNull(source, "source");
        StreamTask t = new StreamTask(source);
        pending.add(t);
        log.debug("Enqueued {}", t);
        publish(t);
        return t;
    }

    /** Запустить обработчик. Если он уже работает, вызов ничего не делает. */
    public synchronized void start(Processor processor) {
        Objects.requireNonNull(processor, "processor");
        if (running) return;
        running = true;
        loop = worker.submit(() -> drain(processor));
    }

    /** Текущая задача дорабатывает, следующие остаются в очереди. */
    public synchronized void stop() {
        running = false;
        if (loop != null) loop.cancel(false);
    }

    /** Снять задачу, пока она не начата. */
    public boolean cancel(StreamTask t) {
        if (!pending.remove(t)) {
            return false;
        }
        t.canceled();
        log.info("Canceled {}", t);
        publish(t);
        return true;
    }

    private void drain(Processor processor) {
        while (running) {
            StreamTask t;
            try {
                t = pending.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
            if (t != null) {
                runOne(t, processor);
            }
        }
    }

    private void runOne(StreamTask t, Processor processor) {
        t.started();
        log.info("Stream {} started: {}", t.id, t.source);
        publish(t);
        try {
            CountSnapshot counts = processor.process(t.source, p -> {
                int pct = Math.max(0, Math.min(100, p));
                if (pct != t.progress) {
                    t.progress = pct;
                    publish(t);
                }
            });
            t.completed(counts);
            log.info("Stream {} finished: total={}", t.id, t.counts.total());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            t.failed(ie);
            log.warn("Stream {} interrupted", t.id);
        } catch (Throwable th) {
            // Error из обработчика тоже закрывает задачу, иначе ожидающие её никогда не дождутся
            t.failed(th);
            log.error("Stream {} failed: {}", t.id, t.source, th);
        } finally {
            publish(t);
        }
    }

    private void publish(StreamTask t) {
        for (Listener l : listeners) {
            try {
                l.onUpdate(t);
            } catch (Throwable th) {
                log.warn("Listener failed for {}: {}", t, th.toString());
            }
        }
    }

    @Override
    public void close() {
        stop();
        worker.shutdownNow();
    }
}
