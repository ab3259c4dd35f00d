package com.edge.precision.core.metrics;

public enum MetricsStatus {
    OK("ok"),
    INVALID_SCALE("invalid_scale");

    private final String code;

    MetricsStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
