package com.edge.precision.exception;

/**
 * 轮廓提取失败，流程终止且不产生指标
 */
public class ExtractionFailureException extends PrecisionException {
    private final String stage;
    private final String reason;

    public ExtractionFailureException(String stage, String reason) {
        super(String.format("Contour extraction failed for %s: %s", stage, reason));
        this.stage = stage;
        this.reason = reason;
    }

    public String getStage() {
        return stage;
    }

    public String getReason() {
        return reason;
    }
}
