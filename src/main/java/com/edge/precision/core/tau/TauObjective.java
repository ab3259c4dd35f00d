package com.edge.precision.core.tau;

import com.edge.precision.exception.TauConfigurationException;

import java.util.Comparator;
import java.util.Locale;

/**
 * 标注模式的优化目标，比较器把"更好"的点排在前面，平局时 tau 较小者在前
 */
public enum TauObjective {
    BALANCED_ACCURACY("balanced_accuracy",
        Comparator.comparingDouble(TauCurvePoint::getBalancedAccuracy).reversed()),
    BALANCED_ACCURACY_THEN_GAP("balanced_accuracy_then_gap",
        Comparator.comparingDouble(TauCurvePoint::getBalancedAccuracy).reversed()
            .thenComparing(Comparator.comparingDouble(TauCurvePoint::getMeanIpnGap).reversed())),
    GAP_THEN_BALANCED_ACCURACY("gap_then_balanced_accuracy",
        Comparator.comparingDouble(TauCurvePoint::getMeanIpnGap).reversed()
            .thenComparing(Comparator.comparingDouble(TauCurvePoint::getBalancedAccuracy).reversed())),
    MIN_FALSE_POSITIVE("min_false_positive",
        Comparator.comparingDouble(TauCurvePoint::getTnr).reversed()
            .thenComparing(Comparator.comparingDouble(TauCurvePoint::getTpr).reversed())
            .thenComparing(Comparator.comparingDouble(TauCurvePoint::getMeanIpnGap).reversed()));

    private final String code;
    private final Comparator<TauCurvePoint> ranking;

    TauObjective(String code, Comparator<TauCurvePoint> ranking) {
        this.code = code;
        this.ranking = ranking.thenComparingDouble(TauCurvePoint::getTau);
    }

    public String getCode() {
        return code;
    }

    public Comparator<TauCurvePoint> ranking() {
        return ranking;
    }

    public static TauObjective fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (TauObjective o : values()) {
            if (o.code.equals(normalized)) {
                return o;
            }
        }
        throw new TauConfigurationException("Unknown tau objective: " + name);
    }
}
