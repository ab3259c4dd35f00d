package com.edge.precision.core.metrics;

import com.edge.precision.config.PrecisionConfig;
import com.edge.precision.core.calibration.ScaleCalibration;
import com.edge.precision.core.distance.DistanceField;
import com.edge.precision.core.distance.DistanceFieldBuilder;
import com.edge.precision.core.distance.NearestNeighborValidator;
import com.edge.precision.core.distance.ValidationStatus;
import com.edge.precision.core.model.ResampledContour;
import com.edge.precision.core.resample.ContourResampler;
import com.edge.precision.core.resample.SamplingPolicy;
import com.edge.precision.support.SyntheticImages;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetricsEngineTest {
    private final ContourResampler resampler = new ContourResampler();
    private final SamplingPolicy policy = SamplingPolicy.byStep(1.0, 20000);
    private final ResampledContour ideal = resampler.resample(SyntheticImages.square(100, 100, 100), policy);
    private final DistanceField field = new DistanceFieldBuilder(1).build(ideal, 300, 300);
    private final ScaleCalibration noScale = ScaleCalibration.missing("ruler_detection", Map.of("reason", "no_image"));

    private MetricsEngine engine(boolean validate) {
        PrecisionConfig.DistanceConfig distance = new PrecisionConfig.DistanceConfig();
        distance.setValidateWithKdtree(validate);
        return new MetricsEngine(distance, new PrecisionConfig.MetricsConfig(), new NearestNeighborValidator());
    }

    @Test
    void compute_selfComparison_isPerfect() {
        MetricsResult result = engine(true).compute(ideal, ideal, field, noScale, 0.02);

        assertThat(result.getMadPx()).isCloseTo(0.0, within(1e-6));
        assertThat(result.getMaxPx()).isCloseTo(0.0, within(1e-6));
        assertThat(result.getIpn()).isCloseTo(100.0, within(1e-6));
        assertThat(result.getStatus()).isEqualTo(MetricsStatus.OK);
        assertThat(result.getDiagnostics().getHausdorffPx()).isCloseTo(0.0, within(1e-9));
        assertThat(result.getValidation().getStatus()).isEqualTo(ValidationStatus.OK);
        assertThat(result.getMadMm()).isNull();
        assertThat(result.getIpnMm()).isNull();
    }

    @Test
    void compute_concentricLargerSquare_measuresTwoPixelOffset() {
        ResampledContour real = resampler.resample(SyntheticImages.square(98, 98, 104), policy);

        MetricsResult result = engine(true).compute(ideal, real, field, noScale, 0.02);

        assertThat(result.getMadPx()).isBetween(2.0, 2.15);
        assertThat(result.getMaxPx()).isCloseTo(Math.sqrt(8.0), within(1e-3));
        assertThat(result.getScalePx()).isCloseTo(100.0 * Math.sqrt(2.0), within(1e-9));
        assertThat(result.getTolerancePx()).isCloseTo(0.02 * 100.0 * Math.sqrt(2.0), within(1e-9));
        assertThat(result.getIpnPx()).isBetween(20.0, 35.0);
        assertThat(result.getDiagnostics().getMadRealToIdealPx()).isBetween(2.0, 2.15);
        assertThat(result.getDiagnostics().getMadIdealToRealPx()).isCloseTo(2.0, within(1e-6));
        assertThat(result.getValidation().getStatus()).isEqualTo(ValidationStatus.OK);
        assertThat(result.getPointDistances()).hasSize(real.size());
        assertThat(result.getClampedSamples()).isZero();
    }

    @Test
    void compute_manualScale_reportsMillimeterMetrics() {
        ResampledContour real = resampler.resample(SyntheticImages.square(98, 98, 104), policy);

        MetricsResult result = engine(false).compute(ideal, real, field, ScaleCalibration.manual(0.1), 0.02);

        assertThat(result.getMadMm()).isCloseTo(result.getMadPx() * 0.1, within(1e-12));
        assertThat(result.getScaleMm()).isCloseTo(result.getScalePx() * 0.1, within(1e-12));
        assertThat(result.getIpnMm()).isCloseTo(result.getIpnPx(), within(1e-9));
        assertThat(result.getIpn()).isEqualTo(result.getIpnMm());
        assertThat(result.getPointDistances().get(0).getDistanceMm()).isNotNull();
        assertThat(result.getValidation().getStatus()).isEqualTo(ValidationStatus.SKIPPED);
    }

    @Test
    void compute_zeroTau_marksInvalidScale() {
        MetricsResult result = engine(true).compute(ideal, ideal, field, noScale, 0.0);

        assertThat(result.getStatus()).isEqualTo(MetricsStatus.INVALID_SCALE);
        assertThat(result.getIpn()).isNull();
        assertThat(result.getMadPx()).isCloseTo(0.0, within(1e-6));
    }
}
