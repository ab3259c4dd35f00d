package com.edge.precision.core.tau;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * tau 搜索原语：单调二分与候选网格
 */
public final class TauSearch {
    private static final int MAX_ITERATIONS = 200;
    private static final double DEDUP_EPS = 1e-12;

    private TauSearch() {
    }

    /**
     * 在 [lo, hi] 上对非减函数 f 二分求 f(tau) = target 的最小 tau
     *
     * @return 目标不在 [f(lo), f(hi)] 内时返回 null
     */
    public static Double bisect(DoubleUnaryOperator f, double lo, double hi, double target, double tolerance) {
        double fLo = f.applyAsDouble(lo);
        double fHi = f.applyAsDouble(hi);
        if (fLo > target + tolerance || fHi < target - tolerance) {
            return null;
        }
        if (Math.abs(fLo - target) <= tolerance) {
            return lo;
        }
        double a = lo;
        double b = hi;
        for (int i = 0; i < MAX_ITERATIONS && b - a > DEDUP_EPS; i++) {
            double mid = 0.5 * (a + b);
            double fm = f.applyAsDouble(mid);
            if (fm < target) {
                a = mid;
            } else {
                b = mid;
            }
        }
        return b;
    }

    /**
     * 候选网格：各报告的接受边界 ratio / factor 与区间端点，加上相邻点中点；
     * 去重排序后按等距下标抽样到不超过 maxPoints 个
     */
    public static double[] candidateGrid(double[] ratios, double factor, double tauMin, double tauMax, int maxPoints) {
        List<Double> boundaries = new ArrayList<>();
        boundaries.add(tauMin);
        boundaries.add(tauMax);
        for (double r : ratios) {
            double boundary = r / factor;
            if (Double.isFinite(boundary)) {
                boundaries.add(Math.max(tauMin, Math.min(tauMax, boundary)));
            }
        }
        double[] sorted = dedupSorted(boundaries);

        List<Double> all = new ArrayList<>();
        for (int i = 0; i < sorted.length; i++) {
            all.add(sorted[i]);
            if (i + 1 < sorted.length) {
                all.add(0.5 * (sorted[i] + sorted[i + 1]));
            }
        }
        double[] grid = dedupSorted(all);
        return downsample(grid, maxPoints);
    }

    static double[] dedupSorted(List<Double> values) {
        double[] arr = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(arr);
        List<Double> unique = new ArrayList<>();
        for (double v : arr) {
            if (unique.isEmpty() || v - unique.get(unique.size() - 1) > DEDUP_EPS) {
                unique.add(v);
            }
        }
        return unique.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * 按 round(linspace(0, n-1, maxPoints)) 下标抽样，首尾保留
     */
    static double[] downsample(double[] grid, int maxPoints) {
        if (grid.length <= maxPoints) {
            return grid;
        }
        if (maxPoints == 1) {
            return new double[]{grid[0]};
        }
        List<Double> picked = new ArrayList<>();
        int last = -1;
        for (int i = 0; i < maxPoints; i++) {
            int idx = (int) Math.round((double) i * (grid.length - 1) / (maxPoints - 1));
            if (idx != last) {
                picked.add(grid[idx]);
                last = idx;
            }
        }
        return picked.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
