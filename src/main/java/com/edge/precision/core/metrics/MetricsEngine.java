package com.edge.precision.core.metrics;

import com.edge.precision.config.PrecisionConfig;
import com.edge.precision.core.calibration.ScaleCalibration;
import com.edge.precision.core.distance.DistanceField;
import com.edge.precision.core.distance.DistanceValidation;
import com.edge.precision.core.distance.NearestNeighborValidator;
import com.edge.precision.core.model.ContourPoints;
import com.edge.precision.core.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 指标引擎
 * <p>
 * 主距离取自距离场采样；KD 树提供交叉校验和双向诊断；
 * 尺度为理想轮廓边界框对角线，容差 = tau * 尺度
 */
public class MetricsEngine {
    private static final Logger logger = LoggerFactory.getLogger(MetricsEngine.class);

    private final PrecisionConfig.DistanceConfig distanceConfig;
    private final PrecisionConfig.MetricsConfig metricsConfig;
    private final NearestNeighborValidator validator;

    public MetricsEngine(PrecisionConfig.DistanceConfig distanceConfig, PrecisionConfig.MetricsConfig metricsConfig,
                         NearestNeighborValidator validator) {
        this.distanceConfig = distanceConfig;
        this.metricsConfig = metricsConfig;
        this.validator = validator;
    }

    /**
     * @param ideal       重采样后的理想轮廓
     * @param realAligned 配准并重采样后的实测轮廓
     * @param tau         本次运行使用的相对容差
     */
    public MetricsResult compute(ContourPoints ideal, ContourPoints realAligned, DistanceField field,
                                 ScaleCalibration calibration, double tau) {
        if (ideal.isEmpty() || realAligned.isEmpty()) {
            throw new IllegalArgumentException("Metrics need non-empty ideal and real contours");
        }

        // 1. 距离场逐点距离
        DistanceField.Samples samples = field.sample(realAligned.getPoints(), distanceConfig.isUseBilinear());
        double[] distancesPx = samples.getValues();
        if (samples.getClampedCount() > 0) {
            logger.warn("{} real contour points fall outside the distance field and were clamped", samples.getClampedCount());
        }

        // 2. 双向最近邻诊断
        double[] realToIdeal = validator.nearestDistances(realAligned, ideal);
        double[] idealToReal = validator.nearestDistances(ideal, realAligned);
        ContourDiagnostics diagnostics = ContourDiagnostics.of(realToIdeal, idealToReal);

        // 3. 距离场与 KD 树交叉校验
        DistanceValidation validation;
        if (distanceConfig.isValidateWithKdtree()) {
            validation = validator.validate(distancesPx, realAligned, ideal, distanceConfig.getValidationTolerancePx());
            if (validation.isMismatch()) {
                logger.warn("Distance validation mismatch: field MAD={}, kd-tree MAD={}, tolerance={}",
                    validation.getFieldMadPx(), validation.getValidatorMadPx(), validation.getTolerancePx());
            }
        } else {
            validation = DistanceValidation.skipped(distanceConfig.getValidationTolerancePx());
        }

        // 4. 统计量
        DistanceStatistics pixel = DistanceStatistics.of(distancesPx);
        DistanceStatistics millimeter = calibration.isCalibrated() ? pixel.scaled(calibration.getMmPerPx()) : null;

        // 5. 尺度、容差与 IPN
        double scalePx = ideal.getBoundingBox().getDiagonal();
        double tolerancePx = tau * scalePx;
        Double scaleMm = calibration.toMm(scalePx);
        Double toleranceMm = calibration.toMm(tolerancePx);

        MetricsStatus status;
        Double ipnPx = null;
        Double ipnMm = null;
        if (IpnCalculator.isValidTolerance(tolerancePx)) {
            status = MetricsStatus.OK;
            ipnPx = IpnCalculator.ipn(pixel.getMad(), tau, scalePx, metricsConfig.getClampLow(), metricsConfig.getClampHigh());
            if (millimeter != null && scaleMm != null) {
                ipnMm = IpnCalculator.ipn(millimeter.getMad(), tau, scaleMm, metricsConfig.getClampLow(), metricsConfig.getClampHigh());
            }
        } else {
            status = MetricsStatus.INVALID_SCALE;
            logger.warn("Invalid scale: tolerance {} px (tau={}, scale={} px), IPN not computed", tolerancePx, tau, scalePx);
        }

        List<PointDistance> pointDistances = new ArrayList<>(distancesPx.length);
        for (int i = 0; i < distancesPx.length; i++) {
            Point p = realAligned.get(i);
            pointDistances.add(new PointDistance(i, p.x, p.y, distancesPx[i], calibration.toMm(distancesPx[i])));
        }

        MetricsResult result = new MetricsResult(pixel, millimeter, diagnostics, scalePx, scaleMm, tau,
            tolerancePx, toleranceMm, ipnPx, ipnMm, status, calibration, validation,
            samples.getClampedCount(), pointDistances);
        logger.info("Metrics computed: {}", result);
        return result;
    }
}
