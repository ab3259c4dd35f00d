package com.edge.precision.core.resample;

import com.edge.precision.core.model.ContourPoints;
import com.edge.precision.core.model.Point;
import com.edge.precision.core.model.ResampledContour;
import com.edge.precision.exception.DegenerateContourException;
import com.edge.precision.support.SyntheticImages;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ContourResamplerTest {
    private final ContourResampler resampler = new ContourResampler();

    @Test
    void resample_squareWithUnitStep_producesEvenlySpacedPoints() {
        ResampledContour result = resampler.resample(SyntheticImages.square(0, 0, 100), SamplingPolicy.byStep(1.0, 20000));

        assertThat(result.size()).isEqualTo(400);
        assertThat(result.getSourcePerimeter()).isCloseTo(400.0, within(1e-9));
        assertThat(result.getStep()).isCloseTo(1.0, within(1e-9));
        assertThat(result.get(0)).isEqualTo(new Point(0, 0));
        assertThat(result.get(150)).isEqualTo(new Point(100, 50));
        for (int i = 0; i < result.size(); i++) {
            Point a = result.get(i);
            Point b = result.get((i + 1) % result.size());
            assertThat(a.distanceTo(b)).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void resample_explicitlyClosedContour_ignoresRepeatedClosingPoint() {
        ContourPoints closed = ContourPoints.of(new double[][]{
            {0, 0}, {100, 0}, {100, 0}, {100, 100}, {0, 100}, {0, 0}
        });

        ResampledContour result = resampler.resample(closed, SamplingPolicy.byStep(1.0, 20000));

        assertThat(result.size()).isEqualTo(400);
        assertThat(result.getSourcePerimeter()).isCloseTo(400.0, within(1e-9));
    }

    @Test
    void resample_resampledContour_keepsPerimeter() {
        SamplingPolicy policy = SamplingPolicy.byStep(1.0, 20000);
        ResampledContour once = resampler.resample(SyntheticImages.square(10, 20, 50), policy);
        ResampledContour twice = resampler.resample(once, policy);

        assertThat(twice.size()).isEqualTo(once.size());
        assertThat(twice.getSourcePerimeter()).isCloseTo(once.getSourcePerimeter(), within(1e-6));
    }

    @Test
    void resample_largeStep_usesAtLeastEightPoints() {
        ResampledContour result = resampler.resample(SyntheticImages.square(0, 0, 10), SamplingPolicy.byStep(1000.0, 20000));

        assertThat(result.size()).isEqualTo(8);
    }

    @Test
    void resample_tinyStep_isCappedByMaxPoints() {
        ResampledContour result = resampler.resample(SyntheticImages.square(0, 0, 100), SamplingPolicy.byStep(0.1, 100));

        assertThat(result.size()).isEqualTo(100);
    }

    @Test
    void resample_fixedCount_returnsExactCount() {
        ResampledContour result = resampler.resample(SyntheticImages.square(0, 0, 100), SamplingPolicy.byCount(50, 20000));

        assertThat(result.size()).isEqualTo(50);
        assertThat(result.getStep()).isCloseTo(8.0, within(1e-9));
    }

    @Test
    void resample_twoDistinctPoints_isDegenerate() {
        ContourPoints line = ContourPoints.of(new double[][]{{0, 0}, {10, 0}, {10, 0}, {0, 0}});

        assertThatThrownBy(() -> resampler.resample(line, SamplingPolicy.byStep(1.0, 100)))
            .isInstanceOf(DegenerateContourException.class);
    }

    @Test
    void resample_emptyContour_isDegenerate() {
        assertThatThrownBy(() -> resampler.resample(ContourPoints.of(new double[0][]), SamplingPolicy.byStep(1.0, 100)))
            .isInstanceOf(DegenerateContourException.class);
    }

    @Test
    void samplingPolicy_nonPositiveStep_isRejected() {
        assertThatThrownBy(() -> SamplingPolicy.byStep(0.0, 100))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
