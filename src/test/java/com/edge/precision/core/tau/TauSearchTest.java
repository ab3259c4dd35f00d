package com.edge.precision.core.tau;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TauSearchTest {

    @Test
    void bisect_monotoneFunction_findsTarget() {
        Double tau = TauSearch.bisect(t -> 100.0 * t, 0.0, 1.0, 50.0, 1e-6);

        assertThat(tau).isCloseTo(0.5, within(1e-6));
    }

    @Test
    void bisect_targetOutsideRange_returnsNull() {
        assertThat(TauSearch.bisect(t -> 100.0 * t, 0.0, 0.4, 50.0, 1e-6)).isNull();
        assertThat(TauSearch.bisect(t -> 100.0 * t, 0.6, 1.0, 50.0, 1e-6)).isNull();
    }

    @Test
    void bisect_plateauAtTarget_returnsSmallestTau() {
        Double tau = TauSearch.bisect(t -> Math.min(100.0, 400.0 * t), 0.0, 1.0, 100.0, 1e-6);

        assertThat(tau).isCloseTo(0.25, within(1e-6));
    }

    @Test
    void candidateGrid_includesBoundariesEndpointsAndMidpoints() {
        double[] grid = TauSearch.candidateGrid(new double[]{0.1}, 0.5, 0.05, 0.5, 400);

        assertThat(grid).containsExactly(new double[]{0.05, 0.125, 0.2, 0.35, 0.5}, within(1e-12));
    }

    @Test
    void candidateGrid_clampsBoundariesIntoRange() {
        double[] grid = TauSearch.candidateGrid(new double[]{0.9, 0.0001}, 0.5, 0.05, 0.5, 400);

        assertThat(grid[0]).isEqualTo(0.05);
        assertThat(grid[grid.length - 1]).isEqualTo(0.5);
        assertThat(grid).hasSize(3);
    }

    @Test
    void downsample_keepsFirstAndLast() {
        double[] grid = TauSearch.downsample(new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10}, 4);

        assertThat(grid).containsExactly(1, 4, 7, 10);
    }

    @Test
    void dedupSorted_removesDuplicates() {
        assertThat(TauSearch.dedupSorted(List.of(0.3, 0.1, 0.3, 0.2))).containsExactly(0.1, 0.2, 0.3);
    }
}
