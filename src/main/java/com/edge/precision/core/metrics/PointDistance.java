package com.edge.precision.core.metrics;

/**
 * 单点距离记录
 */
public class PointDistance {
    private final int index;
    private final double x;
    private final double y;
    private final double distancePx;
    private final Double distanceMm;

    public PointDistance(int index, double x, double y, double distancePx, Double distanceMm) {
        this.index = index;
        this.x = x;
        this.y = y;
        this.distancePx = distancePx;
        this.distanceMm = distanceMm;
    }

    public int getIndex() { return index; }

    public double getX() { return x; }

    public double getY() { return y; }

    public double getDistancePx() { return distancePx; }

    public Double getDistanceMm() { return distanceMm; }
}
