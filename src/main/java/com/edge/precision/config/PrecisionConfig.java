package com.edge.precision.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 切割精度配置
 * <p>
 * 对应 application.yml 中 cut-precision 前缀，启动时绑定一次，运行期间只读
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "cut-precision")
public class PrecisionConfig {
    private ExtractionConfig extraction = new ExtractionConfig();
    private RegistrationConfig registration = new RegistrationConfig();
    private CalibrationConfig calibration = new CalibrationConfig();
    private DistanceConfig distance = new DistanceConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private SamplingConfig sampling = new SamplingConfig();
    private TauConfig tau = new TauConfig();

    @Data
    public static class ExtractionConfig {
        private int blurKernel = 5;
        private int closeKernel = 5;
        // 轮廓面积下限（占图像面积比例）
        private double minAreaRatio = 0.001;
        // 深色切割件、浅色背景
        private boolean invert = true;
    }

    @Data
    public static class RegistrationConfig {
        private boolean useFeatureHomography = true;
        private int orbNfeatures = 3000;
        private double knnRatio = 0.75;
        private double ransacReprojThreshold = 3.0;
        private int minMatches = 20;
        private double minInlierRatio = 0.2;
        private long rngSeed = 12345L;

        private boolean useAxesFallback = true;
        private double axesCannyLow = 50.0;
        private double axesCannyHigh = 150.0;
        private int axesHoughThreshold = 120;
        private double axesSegmentMinLineRatio = 0.05;
        private double axesMaxLineGap = 15.0;
        private double axesAngleToleranceDeg = 20.0;
        private double axesHorizontalRoiMinYRatio = 0.65;
        private double axesVerticalRoiMaxXRatio = 0.35;

        private boolean useEccFallback = true;
        private String eccMotion = "affine";  // translation, euclidean, affine, homography
        private int eccIterations = 1500;
        private double eccEps = 1e-6;
    }

    @Data
    public static class CalibrationConfig {
        // 手动比例优先于标尺检测
        private Double manualMmPerPx;
        private double rulerMm = 120.0;
        private double cannyLow = 50.0;
        private double cannyHigh = 150.0;
        private int houghThreshold = 80;
        private double houghMaxGap = 10.0;
        private double rulerMinLineRatio = 0.2;
    }

    @Data
    public static class DistanceConfig {
        private int drawThickness = 1;
        private boolean useBilinear = true;
        private boolean validateWithKdtree = true;
        private double validationTolerancePx = 1.5;
    }

    @Data
    public static class MetricsConfig {
        private double tau = 0.02;
        private double clampLow = 0.0;
        private double clampHigh = 100.0;
    }

    @Data
    public static class SamplingConfig {
        private double stepPx = 1.5;
        private Integer numPoints;
        private int maxPoints = 20000;
    }

    @Data
    public static class TauConfig {
        private double targetIpn = 80.0;
        private double acceptIpn = 70.0;
        private String statistic = "median";  // mean, median, p75
        private String policy = "balanced";   // strict, balanced, lenient, custom
        private double tauMin = 0.005;
        private double tauMax = 0.5;
        private int curveMaxPoints = 400;
        private boolean preferMm = true;
    }
}
