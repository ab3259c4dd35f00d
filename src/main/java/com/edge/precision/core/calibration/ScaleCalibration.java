package com.edge.precision.core.calibration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 像素到毫米的比例标定结果
 */
public class ScaleCalibration {

    public enum Status {
        RESOLVED("resolved"),
        MANUAL("manual"),
        MISSING("missing");

        private final String code;

        Status(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    private final Double mmPerPx;
    private final Status status;
    private final String method;
    private final Map<String, Object> details;

    public ScaleCalibration(Double mmPerPx, Status status, String method, Map<String, Object> details) {
        this.mmPerPx = mmPerPx;
        this.status = status;
        this.method = method;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ScaleCalibration manual(double mmPerPx) {
        return new ScaleCalibration(mmPerPx, Status.MANUAL, "manual", Map.of());
    }

    public static ScaleCalibration missing(String method, Map<String, Object> details) {
        return new ScaleCalibration(null, Status.MISSING, method, details);
    }

    public boolean isCalibrated() {
        return mmPerPx != null;
    }

    /**
     * 像素值换算为毫米，未标定时返回 null
     */
    public Double toMm(double px) {
        return mmPerPx == null || !Double.isFinite(px) ? null : px * mmPerPx;
    }

    public Double getMmPerPx() { return mmPerPx; }

    public Status getStatus() { return status; }

    public String getMethod() { return method; }

    public Map<String, Object> getDetails() { return details; }

    @Override
    public String toString() {
        return String.format("ScaleCalibration[%s, method=%s, mmPerPx=%s]", status, method, mmPerPx);
    }
}
