package com.edge.precision.core.tau;

import com.edge.precision.exception.TauConfigurationException;

/**
 * tau 标定参数范围校验
 */
final class TauRanges {

    private TauRanges() {
    }

    static void requireIpn(String name, double value) {
        if (!(value > 0.0 && value < 100.0)) {
            throw new TauConfigurationException(name + " must be in (0, 100), got " + value);
        }
    }

    static void requireTauRange(double tauMin, double tauMax) {
        if (!(tauMin > 0.0) || !Double.isFinite(tauMin)) {
            throw new TauConfigurationException("tau-min must be > 0, got " + tauMin);
        }
        if (!(tauMax > tauMin) || !Double.isFinite(tauMax)) {
            throw new TauConfigurationException("tau-max must be > tau-min, got [" + tauMin + ", " + tauMax + "]");
        }
    }

    static void requireMaxPoints(int maxPoints) {
        if (maxPoints <= 0) {
            throw new TauConfigurationException("curve-max-points must be > 0, got " + maxPoints);
        }
    }
}
