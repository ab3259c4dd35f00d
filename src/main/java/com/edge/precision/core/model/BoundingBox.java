package com.edge.precision.core.model;

import java.util.List;

/**
 * 边界框
 * 对角线长度作为 IPN 的归一化尺度
 */
public final class BoundingBox {
    private final double minX;
    private final double maxX;
    private final double minY;
    private final double maxY;

    public BoundingBox(double minX, double maxX, double minY, double maxY) {
        this.minX = minX;
        this.maxX = maxX;
        this.minY = minY;
        this.maxY = maxY;
    }

    /**
     * 计算点集的轴对齐边界框
     */
    public static BoundingBox of(List<Point> points) {
        if (points == null || points.isEmpty()) {
            return new BoundingBox(0, 0, 0, 0);
        }
        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Point p : points) {
            minX = Math.min(minX, p.x);
            maxX = Math.max(maxX, p.x);
            minY = Math.min(minY, p.y);
            maxY = Math.max(maxY, p.y);
        }
        return new BoundingBox(minX, maxX, minY, maxY);
    }

    public double getWidth() {
        return maxX - minX;
    }

    public double getHeight() {
        return maxY - minY;
    }

    public double getDiagonal() {
        return Math.hypot(getWidth(), getHeight());
    }

    public double getMinX() { return minX; }

    public double getMaxX() { return maxX; }

    public double getMinY() { return minY; }

    public double getMaxY() { return maxY; }

    @Override
    public String toString() {
        return String.format("BoundingBox[%.2f,%.2f - %.2f,%.2f] (%.2f x %.2f)",
            minX, minY, maxX, maxY, getWidth(), getHeight());
    }
}
