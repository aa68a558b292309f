package com.roadvision.core.source;

import com.roadvision.core.detection.FrameDims;
import com.roadvision.core.detection.RawDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Реплей детекций из CSV:
 * <pre>frame,t_ms,width,height,x1,y1,x2,y2,conf,class,track</pre>
 * Строки одного кадра идут подряд. Строка с пустыми колонками детекции — кадр без объектов.
 * Пустой track — детекция без идентичности. Битая строка (frame/t_ms/размеры) пропускается с WARN;
 * нечитаемые поля детекции становятся null и отсеиваются уже на приёме в сессии.
 */
public final class CsvFrameSource implements FrameSource {
    private static final Logger log = LoggerFactory.getLogger(CsvFrameSource.class);

    static final String HEADER_MARK = "frame";

    private final Path path;
    private final BufferedReader reader;
    private final long totalFrames;
    private Row pending;    // первая строка следующего кадра
    private long lineNo = 0;
    private boolean eof = false;

    private record Row(long frame, long tMs, int width, int height, RawDetection detection) {}

    public CsvFrameSource(Path path) throws IOException {
        this.path = path;
        this.totalFrames = countFrames(path);
        this.reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }

    @Override
    public Optional<Frame> next() throws IOException {
        Row first = pending != null ? pending : readRow();
        pending = null;
        if (first == null) {
            return Optional.empty();
        }
        List<RawDetection> dets = new ArrayList<>();
        if (first.detection() != null) dets.add(first.detection());
        while (true) {
            Row r = readRow();
            if (r == null) break;
            if (r.frame() != first.frame()) {
                pending = r;
                break;
            }
            if (r.detection() != null) dets.add(r.detection());
        }
        return Optional.of(new Frame(first.frame(), first.tMs(),
                new FrameDims(first.width(), first.height()), dets));
    }

    @Override
    public long totalFrames() {
        return totalFrames;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private Row readRow() throws IOException {
        if (eof) return null;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.isBlank() || line.startsWith("#")) continue;
            if (lineNo == 1 && line.toLowerCase(Locale.ROOT).startsWith(HEADER_MARK)) continue;
            Row r = parse(line);
            if (r != null) return r;
        }
        eof = true;
        return null;
    }

    private Row parse(String line) {
        String[] p = line.split(",", -1);
        if (p.length < 4) {
            log.warn("{}:{} skip row, expected at least 4 columns: {}", path.getFileName(), lineNo, line);
            return null;
        }
        long frame, tMs;
        int w, h;
        try {
            frame = Long.parseLong(p[0].trim());
            tMs = Long.parseLong(p[1].trim());
            w = Integer.parseInt(p[2].trim());
            h = Integer.parseInt(p[3].trim());
        } catch (NumberFormatException e) {
            log.warn("{}:{} skip row, bad frame header: {}", path.getFileName(), lineNo, line);
            return null;
        }
        if (w <= 0 || h <= 0) {
            log.warn("{}:{} skip row, bad frame size {}x{}", path.getFileName(), lineNo, w, h);
            return null;
        }
        RawDetection det = null;
        if (hasDetection(p)) {
            Double conf = dbl(p, 8);
            det = new RawDetection(dbl(p, 4), dbl(p, 5), dbl(p, 6), dbl(p, 7), conf,
                    integer(p, 9, "class"), integer(p, 10, "track"));
        }
        return new Row(frame, tMs, w, h, det);
    }

    private static boolean hasDetection(String[] p) {
        for (int i = 4; i < p.length; i++) {
            if (!p[i].isBlank()) return true;
        }
        return false;
    }

    private static Double dbl(String[] p, int i) {
        if (i >= p.length || p[i].isBlank()) return null;
        try {
            return Double.parseDouble(p[i].trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // "7" и "7.0" дают 7; дробное или за пределами int значение не угадывается, а становится null
    private Integer integer(String[] p, int i, String column) {
        Double v = dbl(p, i);
        if (v == null) return null;
        if (v != Math.rint(v) || v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            log.warn("{}:{} non-integer {} '{}' ignored", path.getFileName(), lineNo, column, p[i].trim());
            return null;
        }
        return v.intValue();
    }

    /** Число различных кадров в файле (подряд идущие номера считаются одним кадром). */
    static long countFrames(Path path) throws IOException {
        long n = 0;
        String last = null;
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            boolean header = true;
            while ((line = br.readLine()) != null) {
                if (header) {
                    header = false;
                    if (line.toLowerCase(Locale.ROOT).startsWith(HEADER_MARK)) continue;
                }
                if (line.isBlank() || line.startsWith("#")) continue;
                int comma = line.indexOf(',');
                String key = comma > 0 ? line.substring(0, comma).trim() : line.trim();
                try {
                    Long.parseLong(key);
                } catch (NumberFormatException e) {
                    continue;   // битая строка, next() её тоже пропустит
                }
                if (!key.equals(last)) {
                    n++;
                    last = key;
                }
            }
        }
        return n;
    }
}
