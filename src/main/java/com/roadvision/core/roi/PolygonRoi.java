package com.roadvision.core.roi;

import java.util.List;

/**
 * Произвольный многоугольник ROI. Вершины в долях ширины/высоты кадра, поэтому одна и та же
 * конфигурация работает при любом разрешении. Проверка "точка в многоугольнике" чётно-нечётным лучом.
 */
public final class PolygonRoi implements RoiFilter {

    public record Vertex(double x, double y) {
        public Vertex {
            if (Double.isNaN(x) || Double.isNaN(y) || x < 0 || x > 1 || y < 0 || y > 1) {
                throw new IllegalArgumentException("roi vertex must be within [0,1]: (" + x + "," + y + ")");
            }
        }
    }

    private final List<Vertex> vertices;

    public PolygonRoi(List<Vertex> vertices) {
        if (vertices == null || vertices.size() < 3) {
            throw new IllegalArgumentException("roi polygon needs at least 3 vertices");
        }
        this.vertices = List.copyOf(vertices);
    }

    @Override
    public boolean isEligible(int x, int y, int frameWidth, int frameHeight) {
        double px = x / (double) frameWidth;
        double py = y / (double) frameHeight;
        boolean inside = false;
        int n = vertices.size();
        for (int i = 0, j = n - 1; i < n; j = i++) {
            Vertex a = vertices.get(i);
            Vertex b = vertices.get(j);
            if ((a.y() > py) != (b.y() > py)) {
                double xCross = (b.x() - a.x()) * (py - a.y()) / (b.y() - a.y()) + a.x();
                if (px < xCross) {
                    inside = !inside;
                }
            }
        }
        return inside;
    }

    public List<Vertex> vertices() {
        return vertices;
    }
}
