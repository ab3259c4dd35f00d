package com.edge.precision.dto;

import com.edge.precision.core.tau.TauCalibrationRequest;
import lombok.Data;

import java.nio.file.Path;

/**
 * 单次比对请求；为 null 的覆盖项使用配置默认值
 */
@Data
public class ComparisonRequest {
    private Path templateImage;
    private Path testImage;
    private Path outputDir;

    // 单次运行覆盖
    private Double tau;
    private Double stepPx;
    private Integer numPoints;
    private Double manualMmPerPx;
    private Boolean validateWithKdtree;

    // 自动 tau（目标或标注模式），与固定 tau 互斥
    private TauCalibrationRequest tauCalibration;
}
