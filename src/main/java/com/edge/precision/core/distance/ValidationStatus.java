package com.edge.precision.core.distance;

/**
 * 距离校验状态
 */
public enum ValidationStatus {
    OK("ok"),
    MISMATCH("mismatch"),
    SKIPPED("skipped"),
    INVALID_INPUTS("invalid_inputs");

    private final String code;

    ValidationStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
