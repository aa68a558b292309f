package com.roadvision.app;

import com.roadvision.core.counting.CountingMode;
import com.roadvision.core.counting.CrossingReference;
import com.roadvision.core.counting.Direction;
import com.roadvision.core.counting.LineSpec;
import com.roadvision.core.counting.SessionSettings;
import com.roadvision.core.counting.UntrackedRule;
import com.roadvision.core.roi.EdgeMarginRoi;
import com.roadvision.core.roi.PolygonRoi;
import com.roadvision.core.roi.RoiFilter;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;


public record Config(CountingConf counting, DisplayConf display, ReplayConf replay) {
    public record LineConf(String name, double ratio, int tolerance, String increasing, String decreasing,
                           String untracked, String defaultDirection, double splitRatio, String leftDirection) {}
    public record CountingConf(String mode, List<LineConf> lines, double trackTimeoutSeconds,
                               double roiMarginRatio, List<List<Double>> roiPolygon,
                               double eventDedupWindowSeconds, int eventDedupDistancePx,
                               List<Integer> eligibleClassIds, double minConfidence,
                               String crossingReference) {}
    public record DisplayConf(Map<String, String> labels, String totalLabel) {}
    public record ReplayConf(String detections, boolean realtime) {}

    /** application.yaml из classpath; -Drv.config=<файл> подменяет его целиком. */
    public static Config load() {
        String external = System.getProperty("rv.config");
        if (external != null && !external.isBlank()) {
            Path p = Path.of(external);
            try (InputStream in = Files.newInputStream(p)) {
                return parse(in);
            } catch (Exception e) {
                throw new RuntimeException("Failed to load config " + p.toAbsolutePath(), e);
            }
        }
        try (InputStream in = Config.class.getResourceAsStream("/application.yaml")) {
            if (in == null) {
                throw new IllegalStateException("application.yaml not found on classpath");
            }
            return parse(in);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load application.yaml", e);
        }
    }

    @SuppressWarnings("unchecked")
    public static Config parse(InputStream in) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(in);
        if (root == null) root = Map.of();

        Map<String, Object> cnt = (Map<String, Object>) root.getOrDefault("counting", Map.of());
        Map<String, Object> disp = (Map<String, Object>) root.getOrDefault("display", Map.of());
        Map<String, Object> rep = (Map<String, Object>) root.getOrDefault("replay", Map.of());

        List<LineConf> lines = new ArrayList<>();
        for (Map<String, Object> l : (List<Map<String, Object>>) cnt.getOrDefault("lines", List.of())) {
            lines.add(new LineConf(
                    (String) l.get("name"),
                    l.get("ratio")      != null ? ((Number) l.get("ratio")).doubleValue()     : 0.5,
                    l.get("tolerance")  != null ? ((Number) l.get("tolerance")).intValue()    : LineSpec.DEFAULT_TOLERANCE,
                    (String) l.getOrDefault("increasing", "down"),
                    (String) l.getOrDefault("decreasing", "up"),
                    (String) l.getOrDefault("untracked", "default"),
                    (String) l.getOrDefault("defaultDirection", "increasing"),
                    l.get("splitRatio") != null ? ((Number) l.get("splitRatio")).doubleValue() : 0.5,
                    (String) l.getOrDefault("leftDirection", "decreasing")));
        }

        List<List<Double>> polygon = new ArrayList<>();
        for (List<Number> v : (List<List<Number>>) cnt.getOrDefault("roiPolygon", List.of())) {
            if (v.size() != 2) {
                throw new IllegalArgumentException("roiPolygon vertex must be [x, y]: " + v);
            }
            polygon.add(List.of(v.get(0).doubleValue(), v.get(1).doubleValue()));
        }

        List<Integer> classes = new ArrayList<>();
        for (Number n : (List<Number>) cnt.getOrDefault("eligibleClassIds", List.of())) {
            classes.add(n.intValue());
        }

        String mode            = (String) cnt.getOrDefault("mode", "tracked");
        double timeoutSec      = cnt.get("trackTimeoutSeconds")     != null ? ((Number) cnt.get("trackTimeoutSeconds")).doubleValue()     : 2.0;
        double marginRatio     = cnt.get("roiMarginRatio")          != null ? ((Number) cnt.get("roiMarginRatio")).doubleValue()          : EdgeMarginRoi.DEFAULT_MARGIN_RATIO;
        double dedupWindowSec  = cnt.get("eventDedupWindowSeconds") != null ? ((Number) cnt.get("eventDedupWindowSeconds")).doubleValue() : 1.0;
        int dedupDistancePx    = cnt.get("eventDedupDistancePx")    != null ? ((Number) cnt.get("eventDedupDistancePx")).intValue()       : SessionSettings.DEFAULT_DEDUP_DISTANCE_PX;
        double minConfidence   = cnt.get("minConfidence")           != null ? ((Number) cnt.get("minConfidence")).doubleValue()           : 0.0;
        String crossingRef     = (String) cnt.getOrDefault("crossingReference", "previous");

        Map<String, String> labels = new LinkedHashMap<>();
        Map<String, Object> rawLabels = (Map<String, Object>) disp.getOrDefault("labels", Map.of());
        rawLabels.forEach((k, v) -> labels.put(k, String.valueOf(v)));

        return new Config(
                new CountingConf(mode, lines, timeoutSec, marginRatio, polygon,
                        dedupWindowSec, dedupDistancePx, classes, minConfidence, crossingRef),
                new DisplayConf(labels, (String) disp.getOrDefault("totalLabel", "total")),
                new ReplayConf((String) rep.get("detections"), Boolean.TRUE.equals(rep.get("realtime")))
        );
    }

    public record Resolved(SessionSettings settings, List<LineSpec> lines) {}

    /** Перевести секцию counting в параметры ядра. Ошибки значений не исправляются, а бросаются. */
    public Resolved resolveCounting() {
        CountingConf c = counting;
        List<LineSpec> specs = new ArrayList<>();
        for (LineConf l : c.lines()) {
            specs.add(new LineSpec(l.name(), l.ratio(), l.tolerance(), l.increasing(), l.decreasing(),
                    UntrackedRule.parse(l.untracked()),
                    Direction.parse(l.defaultDirection()),
                    l.splitRatio(),
                    Direction.parse(l.leftDirection())));
        }
        RoiFilter roi;
        if (!c.roiPolygon().isEmpty()) {
            List<PolygonRoi.Vertex> vs = new ArrayList<>();
            for (List<Double> v : c.roiPolygon()) {
                vs.add(new PolygonRoi.Vertex(v.get(0), v.get(1)));
            }
            roi = new PolygonRoi(vs);
        } else {
            roi = new EdgeMarginRoi(c.roiMarginRatio());
        }
        SessionSettings settings = new SessionSettings(
                CountingMode.parse(System.getProperty("rv.mode", c.mode())),
                Math.round(c.trackTimeoutSeconds() * 1000.0),
                Math.round(c.eventDedupWindowSeconds() * 1000.0),
                c.eventDedupDistancePx(),
                new LinkedHashSet<>(c.eligibleClassIds()),
                c.minConfidence(),
                roi,
                CrossingReference.parse(c.crossingReference()));
        return new Resolved(settings, specs);
    }
}
