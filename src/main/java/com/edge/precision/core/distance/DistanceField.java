package com.edge.precision.core.distance;

import com.edge.precision.core.model.Point;

import java.util.List;

/**
 * 距离场：每个像素到最近理想轮廓像素的欧氏距离
 * <p>
 * 与理想图像坐标系对齐，越界坐标钳制到最近的有效像素并计数
 */
public class DistanceField {
    private final int width;
    private final int height;
    private final float[] data;

    public DistanceField(int width, int height, float[] data) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Distance field size must be positive: " + width + "x" + height);
        }
        if (data.length != width * height) {
            throw new IllegalArgumentException("Distance field data length mismatch");
        }
        this.width = width;
        this.height = height;
        this.data = data;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double valueAt(int x, int y) {
        return data[y * width + x];
    }

    public boolean contains(double x, double y) {
        return x >= 0 && y >= 0 && x <= width - 1 && y <= height - 1;
    }

    /**
     * 双线性插值采样
     */
    public double sampleBilinear(double x, double y) {
        double cx = clamp(x, 0, width - 1);
        double cy = clamp(y, 0, height - 1);
        int x0 = (int) Math.floor(cx);
        int y0 = (int) Math.floor(cy);
        int x1 = Math.min(x0 + 1, width - 1);
        int y1 = Math.min(y0 + 1, height - 1);
        double wx = cx - x0;
        double wy = cy - y0;

        double top = valueAt(x0, y0) * (1 - wx) + valueAt(x1, y0) * wx;
        double bottom = valueAt(x0, y1) * (1 - wx) + valueAt(x1, y1) * wx;
        return top * (1 - wy) + bottom * wy;
    }

    /**
     * 最近像素采样
     */
    public double sampleNearest(double x, double y) {
        int ix = (int) Math.round(clamp(x, 0, width - 1));
        int iy = (int) Math.round(clamp(y, 0, height - 1));
        return valueAt(ix, iy);
    }

    public double sample(double x, double y, boolean bilinear) {
        return bilinear ? sampleBilinear(x, y) : sampleNearest(x, y);
    }

    /**
     * 批量采样
     */
    public Samples sample(List<Point> points, boolean bilinear) {
        double[] values = new double[points.size()];
        int clamped = 0;
        for (int i = 0; i < values.length; i++) {
            Point p = points.get(i);
            if (!contains(p.x, p.y)) {
                clamped++;
            }
            values[i] = sample(p.x, p.y, bilinear);
        }
        return new Samples(values, clamped);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    /**
     * 批量采样结果
     */
    public static class Samples {
        private final double[] values;
        private final int clampedCount;

        public Samples(double[] values, int clampedCount) {
            this.values = values;
            this.clampedCount = clampedCount;
        }

        public double[] getValues() {
            return values;
        }

        public int getClampedCount() {
            return clampedCount;
        }

        public double mean() {
            if (values.length == 0) {
                return Double.NaN;
            }
            double sum = 0.0;
            for (double v : values) {
                sum += v;
            }
            return sum / values.length;
        }
    }
}
