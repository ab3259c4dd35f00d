package com.edge.precision.core.metrics;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class IpnCalculatorTest {

    @Test
    void ipn_zeroDeviation_isPerfect() {
        assertThat(IpnCalculator.ipn(0.0, 0.02, 100.0)).isEqualTo(100.0);
    }

    @Test
    void ipn_halfTolerance_isFifty() {
        assertThat(IpnCalculator.ipn(1.0, 0.02, 100.0)).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void ipn_beyondTolerance_isClampedToZero() {
        assertThat(IpnCalculator.ipn(5.0, 0.02, 100.0)).isEqualTo(0.0);
    }

    @Test
    void ipn_isNonDecreasingInTau() {
        double previous = -1.0;
        for (double tau = 0.005; tau <= 0.5; tau += 0.005) {
            double ipn = IpnCalculator.ipn(1.3, tau, 100.0);
            assertThat(ipn).isGreaterThanOrEqualTo(previous);
            previous = ipn;
        }
    }

    @Test
    void ipn_degenerateTolerance_isNull() {
        assertThat(IpnCalculator.ipn(1.0, 0.0, 100.0)).isNull();
        assertThat(IpnCalculator.ipn(1.0, 0.02, 1e-12)).isNull();
        assertThat(IpnCalculator.isValidTolerance(Double.NaN)).isFalse();
    }
}
