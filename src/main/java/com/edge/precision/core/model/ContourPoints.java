package com.edge.precision.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 闭合轮廓点序列（首尾相邻，不重复首点）
 */
public class ContourPoints {
    private final List<Point> points;

    public ContourPoints(List<Point> points) {
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public static ContourPoints of(double[][] xy) {
        List<Point> list = new ArrayList<>(xy.length);
        for (double[] p : xy) {
            list.add(new Point(p[0], p[1]));
        }
        return new ContourPoints(list);
    }

    public List<Point> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public Point get(int index) {
        return points.get(index);
    }

    /**
     * 逐点变换，返回新轮廓
     */
    public ContourPoints map(UnaryOperator<Point> mapper) {
        List<Point> mapped = new ArrayList<>(points.size());
        for (Point p : points) {
            mapped.add(mapper.apply(p));
        }
        return new ContourPoints(mapped);
    }

    public BoundingBox getBoundingBox() {
        return BoundingBox.of(points);
    }

    @Override
    public String toString() {
        return String.format("ContourPoints[n=%d]", points.size());
    }
}
