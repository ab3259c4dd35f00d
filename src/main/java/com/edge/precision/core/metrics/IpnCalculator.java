package com.edge.precision.core.metrics;

/**
 * IPN (归一化精度指数) 计算
 * <p>
 * ipn = clamp(100 * (1 - mad / (tau * scale)), low, high)，
 * 容差退化（非有限或小于 1e-9）时返回 null
 */
public final class IpnCalculator {
    public static final double MIN_TOLERANCE = 1e-9;

    private IpnCalculator() {
    }

    public static boolean isValidTolerance(double tolerance) {
        return Double.isFinite(tolerance) && tolerance >= MIN_TOLERANCE;
    }

    public static Double ipn(double mad, double tau, double scale, double clampLow, double clampHigh) {
        double tolerance = tau * scale;
        if (!isValidTolerance(tolerance) || !Double.isFinite(mad)) {
            return null;
        }
        double raw = 100.0 * (1.0 - mad / tolerance);
        return clamp(raw, clampLow, clampHigh);
    }

    /**
     * 默认钳制区间 [0, 100]
     */
    public static Double ipn(double mad, double tau, double scale) {
        return ipn(mad, tau, scale, 0.0, 100.0);
    }

    public static double clamp(double value, double low, double high) {
        return Math.max(low, Math.min(high, value));
    }
}
