package com.edge.precision.core.registration;

/**
 * 配准候选：一种方法给出的变换及其质量指标
 * <p>
 * 失败的候选 valid=false 并带有失败原因，不抛异常
 */
public class RegistrationCandidate {
    private final RegistrationMethod method;
    private final HomographyTransform transform;
    private final boolean valid;
    private final String failureReason;

    private Integer matchesTotal;
    private Integer matchesUsed;
    private Double inlierRatio;
    private Double reprojectionErrorPx;
    private Boolean converged;
    private Double correlation;

    private RegistrationCandidate(RegistrationMethod method, HomographyTransform transform,
                                  boolean valid, String failureReason) {
        this.method = method;
        this.transform = transform;
        this.valid = valid;
        this.failureReason = failureReason;
    }

    public static RegistrationCandidate success(RegistrationMethod method, HomographyTransform transform) {
        return new RegistrationCandidate(method, transform, true, null);
    }

    public static RegistrationCandidate failure(RegistrationMethod method, String reason) {
        return new RegistrationCandidate(method, HomographyTransform.identity(), false, reason);
    }

    /**
     * 带有估计出的变换但未通过质量门限的候选（如内点率过低）
     */
    public static RegistrationCandidate rejected(RegistrationMethod method, HomographyTransform transform, String reason) {
        return new RegistrationCandidate(method, transform, false, reason);
    }

    public RegistrationCandidate withMatches(int total, int used) {
        this.matchesTotal = total;
        this.matchesUsed = used;
        return this;
    }

    public RegistrationCandidate withInlierRatio(double inlierRatio) {
        this.inlierRatio = inlierRatio;
        return this;
    }

    public RegistrationCandidate withReprojectionError(Double reprojectionErrorPx) {
        this.reprojectionErrorPx = reprojectionErrorPx;
        return this;
    }

    public RegistrationCandidate withConvergence(boolean converged, Double correlation) {
        this.converged = converged;
        this.correlation = correlation;
        return this;
    }

    // Getters
    public RegistrationMethod getMethod() { return method; }

    public HomographyTransform getTransform() { return transform; }

    public boolean isValid() { return valid; }

    public String getFailureReason() { return failureReason; }

    public Integer getMatchesTotal() { return matchesTotal; }

    public Integer getMatchesUsed() { return matchesUsed; }

    public Double getInlierRatio() { return inlierRatio; }

    public Double getReprojectionErrorPx() { return reprojectionErrorPx; }

    public Boolean getConverged() { return converged; }

    public Double getCorrelation() { return correlation; }

    @Override
    public String toString() {
        return valid
            ? String.format("RegistrationCandidate[%s, valid, inliers=%s]", method.getCode(), inlierRatio)
            : String.format("RegistrationCandidate[%s, invalid: %s]", method.getCode(), failureReason);
    }
}
