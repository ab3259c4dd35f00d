package com.edge.precision.exception;

import com.edge.precision.core.tau.TauCalibrationResult;

/**
 * 在 tau 搜索区间内无法满足目标或策略约束
 * <p>
 * 携带边界处的最佳近似结果，结果中 constraintsSatisfied 为 false
 */
public class TauSearchExhaustedException extends PrecisionException {
    private final double bestEffortTau;
    private final transient TauCalibrationResult bestEffortResult;

    public TauSearchExhaustedException(String message, double bestEffortTau, TauCalibrationResult bestEffortResult) {
        super(message);
        this.bestEffortTau = bestEffortTau;
        this.bestEffortResult = bestEffortResult;
    }

    public double getBestEffortTau() {
        return bestEffortTau;
    }

    public TauCalibrationResult getBestEffortResult() {
        return bestEffortResult;
    }
}
