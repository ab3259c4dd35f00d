package com.edge.precision.core.resample;

import com.edge.precision.config.PrecisionConfig;

/**
 * 采样策略：固定点数或固定步长，两者都受最大点数限制
 */
public final class SamplingPolicy {
    private static final int MIN_POINTS = 8;

    private final double stepPx;
    private final Integer numPoints;
    private final int maxPoints;

    private SamplingPolicy(double stepPx, Integer numPoints, int maxPoints) {
        if (maxPoints < 3) {
            throw new IllegalArgumentException("maxPoints must be >= 3");
        }
        if (numPoints == null && !(stepPx > 0)) {
            throw new IllegalArgumentException("stepPx must be > 0");
        }
        if (numPoints != null && numPoints < 3) {
            throw new IllegalArgumentException("numPoints must be >= 3");
        }
        this.stepPx = stepPx;
        this.numPoints = numPoints;
        this.maxPoints = maxPoints;
    }

    public static SamplingPolicy byStep(double stepPx, int maxPoints) {
        return new SamplingPolicy(stepPx, null, maxPoints);
    }

    public static SamplingPolicy byCount(int numPoints, int maxPoints) {
        return new SamplingPolicy(0.0, numPoints, maxPoints);
    }

    public static SamplingPolicy from(PrecisionConfig.SamplingConfig config) {
        return new SamplingPolicy(config.getStepPx(), config.getNumPoints(), config.getMaxPoints());
    }

    /**
     * 给定周长下的采样点数
     */
    public int pointCount(double perimeter) {
        int n;
        if (numPoints != null) {
            n = numPoints;
        } else {
            n = Math.max(MIN_POINTS, (int) Math.ceil(perimeter / stepPx));
        }
        return Math.min(n, maxPoints);
    }

    public double getStepPx() {
        return stepPx;
    }

    public Integer getNumPoints() {
        return numPoints;
    }

    public int getMaxPoints() {
        return maxPoints;
    }

    @Override
    public String toString() {
        return numPoints != null
            ? String.format("SamplingPolicy[numPoints=%d, max=%d]", numPoints, maxPoints)
            : String.format("SamplingPolicy[step=%.3f, max=%d]", stepPx, maxPoints);
    }
}
