package com.edge.precision.core.metrics;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DistanceStatisticsTest {

    @Test
    void of_knownValues_computesPopulationStatistics() {
        DistanceStatistics stats = DistanceStatistics.of(new double[]{1, 2, 3, 4});

        assertThat(stats.getMad()).isCloseTo(2.5, within(1e-12));
        assertThat(stats.getStd()).isCloseTo(Math.sqrt(1.25), within(1e-12));
        assertThat(stats.getMax()).isEqualTo(4.0);
        // 线性插值：位置 0.95 * 3 = 2.85
        assertThat(stats.getP95()).isCloseTo(3.85, within(1e-12));
        assertThat(stats.getCount()).isEqualTo(4);
    }

    @Test
    void scaled_multipliesEveryStatistic() {
        DistanceStatistics mm = DistanceStatistics.of(new double[]{1, 2, 3, 4}).scaled(0.1);

        assertThat(mm.getMad()).isCloseTo(0.25, within(1e-12));
        assertThat(mm.getMax()).isCloseTo(0.4, within(1e-12));
        assertThat(mm.getP95()).isCloseTo(0.385, within(1e-12));
    }

    @Test
    void percentile_singleValue_returnsIt() {
        assertThat(DistanceStatistics.percentile(new double[]{7.0}, 95.0)).isEqualTo(7.0);
    }

    @Test
    void of_empty_isNaN() {
        assertThat(DistanceStatistics.of(new double[0]).getMad()).isNaN();
    }
}
