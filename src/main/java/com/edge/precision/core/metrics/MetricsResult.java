package com.edge.precision.core.metrics;

import com.edge.precision.core.calibration.ScaleCalibration;
import com.edge.precision.core.distance.DistanceValidation;

import java.util.Collections;
import java.util.List;

/**
 * 指标计算结果（不可变）
 * <p>
 * 毫米值仅在比例标定成功时存在；容差退化时 ipn 为 null
 */
public class MetricsResult {
    private final DistanceStatistics pixel;
    private final DistanceStatistics millimeter;
    private final ContourDiagnostics diagnostics;
    private final double scalePx;
    private final Double scaleMm;
    private final double tau;
    private final double tolerancePx;
    private final Double toleranceMm;
    private final Double ipnPx;
    private final Double ipnMm;
    private final MetricsStatus status;
    private final ScaleCalibration calibration;
    private final DistanceValidation validation;
    private final int clampedSamples;
    private final List<PointDistance> pointDistances;

    MetricsResult(DistanceStatistics pixel, DistanceStatistics millimeter, ContourDiagnostics diagnostics,
                  double scalePx, Double scaleMm, double tau, double tolerancePx, Double toleranceMm,
                  Double ipnPx, Double ipnMm, MetricsStatus status, ScaleCalibration calibration,
                  DistanceValidation validation, int clampedSamples, List<PointDistance> pointDistances) {
        this.pixel = pixel;
        this.millimeter = millimeter;
        this.diagnostics = diagnostics;
        this.scalePx = scalePx;
        this.scaleMm = scaleMm;
        this.tau = tau;
        this.tolerancePx = tolerancePx;
        this.toleranceMm = toleranceMm;
        this.ipnPx = ipnPx;
        this.ipnMm = ipnMm;
        this.status = status;
        this.calibration = calibration;
        this.validation = validation;
        this.clampedSamples = clampedSamples;
        this.pointDistances = Collections.unmodifiableList(pointDistances);
    }

    public double getMadPx() { return pixel.getMad(); }

    public double getStdPx() { return pixel.getStd(); }

    public double getP95Px() { return pixel.getP95(); }

    public double getMaxPx() { return pixel.getMax(); }

    public Double getMadMm() { return millimeter == null ? null : millimeter.getMad(); }

    public Double getStdMm() { return millimeter == null ? null : millimeter.getStd(); }

    public Double getP95Mm() { return millimeter == null ? null : millimeter.getP95(); }

    public Double getMaxMm() { return millimeter == null ? null : millimeter.getMax(); }

    public DistanceStatistics getPixelStatistics() { return pixel; }

    public DistanceStatistics getMillimeterStatistics() { return millimeter; }

    public ContourDiagnostics getDiagnostics() { return diagnostics; }

    public double getScalePx() { return scalePx; }

    public Double getScaleMm() { return scaleMm; }

    public double getTau() { return tau; }

    public double getTolerancePx() { return tolerancePx; }

    public Double getToleranceMm() { return toleranceMm; }

    public Double getIpnPx() { return ipnPx; }

    public Double getIpnMm() { return ipnMm; }

    /**
     * 主 IPN：已标定时取毫米口径，否则取像素口径
     */
    public Double getIpn() { return ipnMm != null ? ipnMm : ipnPx; }

    public MetricsStatus getStatus() { return status; }

    public ScaleCalibration getCalibration() { return calibration; }

    public DistanceValidation getValidation() { return validation; }

    public int getClampedSamples() { return clampedSamples; }

    public List<PointDistance> getPointDistances() { return pointDistances; }

    @Override
    public String toString() {
        return String.format("MetricsResult[mad=%.4fpx, p95=%.4fpx, scale=%.2fpx, tau=%.4f, ipn=%s, status=%s]",
            getMadPx(), getP95Px(), scalePx, tau, getIpn(), status.getCode());
    }
}
