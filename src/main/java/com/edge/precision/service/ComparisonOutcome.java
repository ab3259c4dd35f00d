package com.edge.precision.service;

import com.edge.precision.core.calibration.ScaleCalibration;
import com.edge.precision.core.metrics.MetricsResult;
import com.edge.precision.core.model.ResampledContour;
import com.edge.precision.core.registration.SelectedRegistration;

/**
 * 单次比对的全部中间与最终结果
 */
public class ComparisonOutcome {
    private final ResampledContour idealResampled;
    private final ResampledContour realAligned;
    private final SelectedRegistration registration;
    private final ScaleCalibration calibration;
    private final MetricsResult metrics;

    public ComparisonOutcome(ResampledContour idealResampled, ResampledContour realAligned,
                             SelectedRegistration registration, ScaleCalibration calibration, MetricsResult metrics) {
        this.idealResampled = idealResampled;
        this.realAligned = realAligned;
        this.registration = registration;
        this.calibration = calibration;
        this.metrics = metrics;
    }

    public ResampledContour getIdealResampled() { return idealResampled; }

    public ResampledContour getRealAligned() { return realAligned; }

    public SelectedRegistration getRegistration() { return registration; }

    public ScaleCalibration getCalibration() { return calibration; }

    public MetricsResult getMetrics() { return metrics; }
}
