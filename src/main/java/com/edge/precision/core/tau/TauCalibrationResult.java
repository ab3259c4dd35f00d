package com.edge.precision.core.tau;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * tau 标定结果
 */
@Data
public class TauCalibrationResult {
    private String mode;
    private Double tau;
    private String units;

    @JsonProperty("tau_min")
    private double tauMin;

    @JsonProperty("tau_max")
    private double tauMax;

    @JsonProperty("constraints_satisfied")
    private boolean constraintsSatisfied = true;

    @JsonProperty("fallback_reason")
    private String fallbackReason;

    // 目标模式
    @JsonProperty("target_ipn")
    private Double targetIpn;

    private String statistic;

    @JsonProperty("achieved_ipn")
    private Double achievedIpn;

    @JsonProperty("report_count")
    private Integer reportCount;

    @JsonProperty("per_report_tau")
    private List<Double> perReportTau = new ArrayList<>();

    @JsonProperty("report_paths")
    private List<String> reportPaths = new ArrayList<>();

    // 标注模式
    @JsonProperty("accept_ipn")
    private Double acceptIpn;

    private String policy;
    private String objective;
    private Map<String, Double> constraints = new LinkedHashMap<>();

    @JsonProperty("feasible_points")
    private Integer feasiblePoints;

    @JsonProperty("grid_points")
    private Integer gridPoints;

    @JsonProperty("good_count")
    private Integer goodCount;

    @JsonProperty("bad_count")
    private Integer badCount;

    private Integer tp;
    private Integer fn;
    private Integer tn;
    private Integer fp;
    private Double tpr;
    private Double tnr;

    @JsonProperty("balanced_accuracy")
    private Double balancedAccuracy;

    @JsonProperty("mean_ipn_good")
    private Double meanIpnGood;

    @JsonProperty("mean_ipn_bad")
    private Double meanIpnBad;

    @JsonProperty("mean_ipn_gap")
    private Double meanIpnGap;

    @JsonProperty("good_report_paths")
    private List<String> goodReportPaths = new ArrayList<>();

    @JsonProperty("bad_report_paths")
    private List<String> badReportPaths = new ArrayList<>();

    // 曲线导出
    @JsonProperty("curve_csv")
    private String curveCsv;

    @JsonProperty("curve_png")
    private String curvePng;

    @JsonProperty("curve_points")
    private Integer curvePoints;

    /**
     * 填充某个曲线点的分类统计
     */
    public void applyPoint(TauCurvePoint point) {
        this.tau = point.getTau();
        this.tp = point.getTp();
        this.fn = point.getFn();
        this.tn = point.getTn();
        this.fp = point.getFp();
        this.tpr = point.getTpr();
        this.tnr = point.getTnr();
        this.balancedAccuracy = point.getBalancedAccuracy();
        this.meanIpnGood = point.getMeanIpnGood();
        this.meanIpnBad = point.getMeanIpnBad();
        this.meanIpnGap = point.getMeanIpnGap();
    }
}
