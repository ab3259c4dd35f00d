package com.edge.precision.core.metrics;

import java.util.Arrays;

/**
 * 距离统计：均值 (MAD)、总体标准差、线性插值 P95、最大值
 */
public final class DistanceStatistics {
    private final double mad;
    private final double std;
    private final double p95;
    private final double max;
    private final int count;

    private DistanceStatistics(double mad, double std, double p95, double max, int count) {
        this.mad = mad;
        this.std = std;
        this.p95 = p95;
        this.max = max;
        this.count = count;
    }

    public static DistanceStatistics of(double[] distances) {
        if (distances.length == 0) {
            return new DistanceStatistics(Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0);
        }
        double sum = 0.0;
        double max = Double.NEGATIVE_INFINITY;
        for (double d : distances) {
            sum += d;
            max = Math.max(max, d);
        }
        double mean = sum / distances.length;
        double sq = 0.0;
        for (double d : distances) {
            sq += (d - mean) * (d - mean);
        }
        double std = Math.sqrt(sq / distances.length);
        return new DistanceStatistics(mean, std, percentile(distances, 95.0), max, distances.length);
    }

    /**
     * 线性插值百分位数 (q in [0, 100])
     */
    public static double percentile(double[] values, double q) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double pos = q / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, sorted.length - 1);
        return sorted[lo] + (pos - lo) * (sorted[hi] - sorted[lo]);
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double max(double[] values) {
        return values.length == 0 ? Double.NaN : Arrays.stream(values).max().getAsDouble();
    }

    public DistanceStatistics scaled(double factor) {
        return new DistanceStatistics(mad * factor, std * factor, p95 * factor, max * factor, count);
    }

    public double getMad() { return mad; }

    public double getStd() { return std; }

    public double getP95() { return p95; }

    public double getMax() { return max; }

    public int getCount() { return count; }

    @Override
    public String toString() {
        return String.format("DistanceStatistics[mad=%.4f, std=%.4f, p95=%.4f, max=%.4f, n=%d]", mad, std, p95, max, count);
    }
}
