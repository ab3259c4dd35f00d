package com.edge.precision.dto;

import com.edge.precision.core.tau.TauCalibrationResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 比对报告 (report.json)
 * <p>
 * 失败报告只有 status / stages 等字段，没有指标块
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComparisonReport {
    public static final String STATUS_OK = "ok";
    public static final String STATUS_FAILED = "failed";

    private String status;

    @JsonProperty("run_id")
    private String runId;

    @JsonProperty("timestamp_utc")
    private Instant timestampUtc;

    private Map<String, String> inputs = new LinkedHashMap<>();

    // 失败时各阶段状态
    private Map<String, StageStatus> stages;

    private RegistrationBlock registration;
    private CalibrationBlock calibration;

    @JsonProperty("distance_method")
    private DistanceMethodBlock distanceMethod;

    private DiagnosticsBlock diagnostics;
    private MetricsBlock metrics;

    @JsonProperty("tau_calibration")
    private TauCalibrationBlock tauCalibration;

    private Map<String, String> artifacts = new LinkedHashMap<>();
    private Map<String, Object> config;

    @Data
    public static class StageStatus {
        private boolean success;
        private String reason;

        public StageStatus() {
        }

        public StageStatus(boolean success, String reason) {
            this.success = success;
            this.reason = reason;
        }
    }

    @Data
    public static class RegistrationBlock {
        private String status;      // ok, degraded
        private String method;

        @JsonProperty("selection_strategy")
        private String selectionStrategy = "min_trial_mad";

        @JsonProperty("selection_mad_px")
        private Double selectionMadPx;

        @JsonProperty("inlier_ratio")
        private Double inlierRatio;

        @JsonProperty("reprojection_error_px")
        private Double reprojectionErrorPx;

        @JsonProperty("matches_used")
        private Integer matchesUsed;

        private double[][] transform;
        private List<CandidateRow> candidates = new ArrayList<>();
    }

    @Data
    public static class CandidateRow {
        private String method;
        private boolean valid;
        private String reason;

        @JsonProperty("matches_total")
        private Integer matchesTotal;

        @JsonProperty("matches_used")
        private Integer matchesUsed;

        @JsonProperty("inlier_ratio")
        private Double inlierRatio;

        @JsonProperty("reprojection_error_px")
        private Double reprojectionErrorPx;

        private Boolean converged;
        private Double correlation;

        @JsonProperty("selection_mad_px")
        private Double selectionMadPx;
    }

    @Data
    public static class CalibrationBlock {
        private String status;      // resolved, manual, missing
        private String method;

        @JsonProperty("mm_per_px")
        private Double mmPerPx;

        private Map<String, Object> details = new LinkedHashMap<>();
    }

    @Data
    public static class DistanceMethodBlock {
        private String primary = "distance_transform";
        private String validation;  // kdtree, disabled

        @JsonProperty("validation_status")
        private String validationStatus;

        @JsonProperty("validation_tolerance_px")
        private double validationTolerancePx;

        @JsonProperty("field_mad_px")
        private Double fieldMadPx;

        @JsonProperty("validator_mad_px")
        private Double validatorMadPx;

        @JsonProperty("mad_delta_px")
        private Double madDeltaPx;

        @JsonProperty("mean_abs_delta_px")
        private Double meanAbsDeltaPx;

        private boolean bilinear;

        @JsonProperty("clamped_samples")
        private int clampedSamples;
    }

    @Data
    public static class DiagnosticsBlock {
        @JsonProperty("mad_r2i_px")
        private double madRealToIdealPx;

        @JsonProperty("mad_i2r_px")
        private double madIdealToRealPx;

        @JsonProperty("bidirectional_mad_px")
        private double bidirectionalMadPx;

        @JsonProperty("hausdorff_px")
        private double hausdorffPx;

        @JsonProperty("mad_r2i_mm")
        private Double madRealToIdealMm;

        @JsonProperty("mad_i2r_mm")
        private Double madIdealToRealMm;

        @JsonProperty("bidirectional_mad_mm")
        private Double bidirectionalMadMm;

        @JsonProperty("hausdorff_mm")
        private Double hausdorffMm;

        @JsonProperty("ideal_points")
        private int idealPoints;

        @JsonProperty("real_points")
        private int realPoints;
    }

    @Data
    public static class MetricsBlock {
        @JsonProperty("mad_px")
        private double madPx;

        @JsonProperty("std_px")
        private double stdPx;

        @JsonProperty("p95_px")
        private double p95Px;

        @JsonProperty("max_px")
        private double maxPx;

        @JsonProperty("mad_mm")
        private Double madMm;

        @JsonProperty("std_mm")
        private Double stdMm;

        @JsonProperty("p95_mm")
        private Double p95Mm;

        @JsonProperty("max_mm")
        private Double maxMm;

        @JsonProperty("scale_px")
        private double scalePx;

        @JsonProperty("scale_mm")
        private Double scaleMm;

        private double tau;

        @JsonProperty("tolerance_px")
        private double tolerancePx;

        @JsonProperty("tolerance_mm")
        private Double toleranceMm;

        @JsonProperty("ipn_px")
        private Double ipnPx;

        @JsonProperty("ipn_mm")
        private Double ipnMm;

        private Double ipn;

        @JsonProperty("metrics_status")
        private String metricsStatus;
    }

    @Data
    public static class TauCalibrationBlock {
        private String mode;        // fixed, auto_from_reports, auto_from_labeled_reports

        @JsonProperty("tau_used")
        private double tauUsed;

        private TauCalibrationResult result;
    }
}
