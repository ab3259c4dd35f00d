package com.edge.precision.core.model;

import java.util.List;

/**
 * 按弧长等间距重采样后的闭合轮廓
 */
public class ResampledContour extends ContourPoints {
    private final double sourcePerimeter;
    private final double step;

    public ResampledContour(List<Point> points, double sourcePerimeter, double step) {
        super(points);
        this.sourcePerimeter = sourcePerimeter;
        this.step = step;
    }

    /**
     * 原始轮廓周长
     */
    public double getSourcePerimeter() {
        return sourcePerimeter;
    }

    /**
     * 实际采样步长 (周长 / 点数)
     */
    public double getStep() {
        return step;
    }

    @Override
    public String toString() {
        return String.format("ResampledContour[n=%d, step=%.3f, perimeter=%.2f]", size(), step, sourcePerimeter);
    }
}
