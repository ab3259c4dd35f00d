package com.edge.precision.core.tau;

/**
 * 标注模式的计算产物：结果与对应的 tau 曲线
 */
public class LabeledCalibration {
    private final TauCalibrationResult result;
    private final TauCurve curve;

    public LabeledCalibration(TauCalibrationResult result, TauCurve curve) {
        this.result = result;
        this.curve = curve;
    }

    public TauCalibrationResult getResult() {
        return result;
    }

    public TauCurve getCurve() {
        return curve;
    }

    public boolean isSatisfied() {
        return result.isConstraintsSatisfied();
    }
}
