package com.roadvision.core.source;

import java.io.IOException;
import java.util.Optional;

/**
 * Последовательный источник кадров с детекциями (файл реплея, поток внешнего детектора).
 * Конец потока — это {@code Optional.empty()}, а не исключение; исключение означает сбой.
 */
public interface FrameSource extends AutoCloseable {

    Optional<Frame> next() throws IOException;

    /** Общее число кадров, если известно заранее; -1 иначе. Нужно только для прогресса. */
    default long totalFrames() {
        return -1;
    }

    @Override
    void close() throws IOException;
}
