package com.edge.precision.core.distance;

import com.edge.precision.core.model.ContourPoints;
import com.edge.precision.core.model.Point;
import com.edge.precision.core.model.ResampledContour;
import com.edge.precision.core.resample.ContourResampler;
import com.edge.precision.core.resample.SamplingPolicy;
import com.edge.precision.support.SyntheticImages;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NearestNeighborValidatorTest {
    private final NearestNeighborValidator validator = new NearestNeighborValidator();
    private final ResampledContour reference =
        new ContourResampler().resample(SyntheticImages.square(0, 0, 100), SamplingPolicy.byStep(1.0, 20000));

    @Test
    void nearestDistances_identicalContours_areZero() {
        double[] distances = validator.nearestDistances(reference, reference);

        assertThat(distances).hasSize(reference.size());
        for (double d : distances) {
            assertThat(d).isCloseTo(0.0, within(1e-9));
        }
    }

    @Test
    void nearestDistances_offsetQuery_returnsTrueDistance() {
        ContourPoints queries = ContourPoints.of(new double[][]{{50, -3}, {104, 100}, {50, 50}});

        double[] distances = validator.nearestDistances(queries, reference);

        assertThat(distances[0]).isCloseTo(3.0, within(1e-9));
        assertThat(distances[1]).isCloseTo(4.0, within(1e-9));
        assertThat(distances[2]).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void validate_smallDisagreement_isOkWithinTolerance() {
        ContourPoints shifted = reference.map(p -> new Point(p.x + 0.5, p.y));
        double[] nn = validator.nearestDistances(shifted, reference);
        double[] field = new double[nn.length];
        for (int i = 0; i < nn.length; i++) {
            field[i] = nn[i] + 0.1;
        }

        DistanceValidation loose = validator.validate(field, shifted, reference, 1.5);
        DistanceValidation tight = validator.validate(field, shifted, reference, 0.05);

        assertThat(loose.getStatus()).isEqualTo(ValidationStatus.OK);
        assertThat(loose.getMadDeltaPx()).isCloseTo(0.1, within(1e-9));
        assertThat(loose.getMeanAbsDeltaPx()).isCloseTo(0.1, within(1e-9));
        assertThat(tight.getStatus()).isEqualTo(ValidationStatus.MISMATCH);
        assertThat(tight.isMismatch()).isTrue();
    }

    @Test
    void validate_lengthMismatch_reportsInvalidInputs() {
        DistanceValidation validation = validator.validate(new double[3], reference, reference, 1.5);

        assertThat(validation.getStatus()).isEqualTo(ValidationStatus.INVALID_INPUTS);
    }
}
