package com.edge.precision.core.extract;

import com.edge.precision.core.model.ContourPoints;

/**
 * 轮廓提取结果
 */
public class ExtractionResult {
    private final boolean success;
    private final ContourPoints contour;
    private final String reason;
    private final double area;

    private ExtractionResult(boolean success, ContourPoints contour, String reason, double area) {
        this.success = success;
        this.contour = contour;
        this.reason = reason;
        this.area = area;
    }

    public static ExtractionResult success(ContourPoints contour, double area) {
        return new ExtractionResult(true, contour, null, area);
    }

    public static ExtractionResult failure(String reason) {
        return new ExtractionResult(false, null, reason, 0.0);
    }

    public boolean isSuccess() { return success; }

    public ContourPoints getContour() { return contour; }

    public String getReason() { return reason; }

    public double getArea() { return area; }
}
