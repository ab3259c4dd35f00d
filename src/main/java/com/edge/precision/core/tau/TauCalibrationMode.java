package com.edge.precision.core.tau;

/**
 * tau 来源
 */
public enum TauCalibrationMode {
    FIXED("fixed"),
    TARGET("auto_from_reports"),
    LABELED("auto_from_labeled_reports");

    private final String code;

    TauCalibrationMode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
