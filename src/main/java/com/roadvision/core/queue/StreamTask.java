package com.roadvision.core.queue;

import com.roadvision.core.counting.CountSnapshot;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/** Один поток детекций в очереди: статус, прогресс в процентах и итоговые счётчики. */
public final class StreamTask {
    public enum Status { PENDING, RUNNING, DONE, FAILED, CANCELED }

    private static final AtomicInteger SEQ = new AtomicInteger(1);

    public final int id = SEQ.getAndIncrement();
    public final Path source;
    public volatile Status status = Status.PENDING;
    public volatile int progress = 0;
    public volatile String message = "";
    public volatile CountSnapshot counts = CountSnapshot.EMPTY;
    public volatile Instant startedAt;
    public volatile Instant finishedAt;

    public StreamTask(Path source) {
        this.source = source;
    }

    public boolean isFinished() {
        return status == Status.DONE || status == Status.FAILED || status == Status.CANCELED;
    }

    void started() {
        status = Status.RUNNING;
        startedAt = Instant.now();
        message = "running";
        progress = 0;
    }

    void completed(CountSnapshot result) {
        counts = result == null ? CountSnapshot.EMPTY : result;
        progress = 100;
        message = "done: " + counts.total() + " vehicles";
        finishedAt = Instant.now();
        status = Status.DONE;
    }

    void failed(Throwable cause) {
        message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
        finishedAt = Instant.now();
        status = Status.FAILED;
    }

    void canceled() {
        message = "canceled";
        finishedAt = Instant.now();
        status = Status.CANCELED;
    }

    @Override
    public String toString() {
        return "StreamTask#" + id + "[" + status + " " + progress + "% " + source + "]";
    }
}
