package com.edge.precision.core.distance;

import com.edge.precision.support.SyntheticImages;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DistanceFieldBuilderTest {
    private final DistanceFieldBuilder builder = new DistanceFieldBuilder(1);

    @Test
    void build_square_isZeroOnContourAndEuclideanInside() {
        DistanceField field = builder.build(SyntheticImages.square(20, 20, 60), 100, 100);

        assertThat(field.getWidth()).isEqualTo(100);
        assertThat(field.getHeight()).isEqualTo(100);
        assertThat(field.valueAt(20, 20)).isZero();
        assertThat(field.valueAt(50, 20)).isZero();
        assertThat(field.valueAt(50, 50)).isCloseTo(30.0, within(1e-3));
        assertThat(field.valueAt(50, 10)).isCloseTo(10.0, within(1e-3));
        assertThat(field.valueAt(10, 10)).isCloseTo(Math.hypot(10, 10), within(1e-2));
    }
}
