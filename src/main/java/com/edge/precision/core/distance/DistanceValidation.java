package com.edge.precision.core.distance;

/**
 * 距离场与最近邻索引的交叉校验结果
 */
public class DistanceValidation {
    private final ValidationStatus status;
    private final Double fieldMadPx;
    private final Double validatorMadPx;
    private final Double madDeltaPx;
    private final Double meanAbsDeltaPx;
    private final double tolerancePx;

    public DistanceValidation(ValidationStatus status, Double fieldMadPx, Double validatorMadPx,
                              Double madDeltaPx, Double meanAbsDeltaPx, double tolerancePx) {
        this.status = status;
        this.fieldMadPx = fieldMadPx;
        this.validatorMadPx = validatorMadPx;
        this.madDeltaPx = madDeltaPx;
        this.meanAbsDeltaPx = meanAbsDeltaPx;
        this.tolerancePx = tolerancePx;
    }

    public static DistanceValidation skipped(double tolerancePx) {
        return new DistanceValidation(ValidationStatus.SKIPPED, null, null, null, null, tolerancePx);
    }

    public static DistanceValidation invalidInputs() {
        return new DistanceValidation(ValidationStatus.INVALID_INPUTS, null, null, null, null, 0.0);
    }

    public boolean isMismatch() {
        return status == ValidationStatus.MISMATCH;
    }

    // Getters
    public ValidationStatus getStatus() { return status; }

    public Double getFieldMadPx() { return fieldMadPx; }

    public Double getValidatorMadPx() { return validatorMadPx; }

    public Double getMadDeltaPx() { return madDeltaPx; }

    public Double getMeanAbsDeltaPx() { return meanAbsDeltaPx; }

    public double getTolerancePx() { return tolerancePx; }

    @Override
    public String toString() {
        return String.format("DistanceValidation[%s, field=%s, validator=%s, delta=%s]",
            status.getCode(), fieldMadPx, validatorMadPx, madDeltaPx);
    }
}
