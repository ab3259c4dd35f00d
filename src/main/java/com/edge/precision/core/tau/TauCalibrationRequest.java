package com.edge.precision.core.tau;

import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * tau 标定请求
 * <p>
 * reportPatterns 与 goodPatterns/badPatterns 互斥；未设置的数值项取配置默认值
 */
@Data
public class TauCalibrationRequest {
    // 目标模式
    private List<String> reportPatterns = new ArrayList<>();
    private Double targetIpn;
    private String statistic;

    // 标注模式
    private List<String> goodPatterns = new ArrayList<>();
    private List<String> badPatterns = new ArrayList<>();
    private Double acceptIpn;
    private String policy;
    private String objective;
    private Double maxMeanIpnBad;
    private Double minMeanIpnGap;
    private Double minTpr;
    private Double minTnr;

    // 通用
    private Double tauMin;
    private Double tauMax;
    private Boolean preferMm;
    private Integer curveMaxPoints;
    private Path curveCsv;
    private Path curvePng;

    public boolean hasTargetInputs() {
        return reportPatterns != null && !reportPatterns.isEmpty();
    }

    public boolean hasLabeledInputs() {
        return (goodPatterns != null && !goodPatterns.isEmpty()) || (badPatterns != null && !badPatterns.isEmpty());
    }

    public boolean isCurveExportRequested() {
        return curveCsv != null || curvePng != null;
    }
}
