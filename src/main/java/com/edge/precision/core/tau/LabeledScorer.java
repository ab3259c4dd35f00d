package com.edge.precision.core.tau;

import com.edge.precision.core.metrics.IpnCalculator;

/**
 * 给定 tau 对好/坏两组报告打分
 * <p>
 * 报告在 tau 下被接受当且仅当 mad/scale <= tau * (1 - accept/100)，即 IPN >= accept
 */
public class LabeledScorer {
    private final double[] goodRatios;
    private final double[] badRatios;
    private final double acceptIpn;

    public LabeledScorer(double[] goodRatios, double[] badRatios, double acceptIpn) {
        this.goodRatios = goodRatios.clone();
        this.badRatios = badRatios.clone();
        this.acceptIpn = acceptIpn;
    }

    public double acceptFactor() {
        return 1.0 - acceptIpn / 100.0;
    }

    public TauCurvePoint score(double tau) {
        double threshold = tau * acceptFactor();
        int tp = 0;
        int fn = 0;
        double ipnGood = 0.0;
        for (double r : goodRatios) {
            if (r <= threshold) {
                tp++;
            } else {
                fn++;
            }
            ipnGood += ipn(r, tau);
        }
        int tn = 0;
        int fp = 0;
        double ipnBad = 0.0;
        for (double r : badRatios) {
            if (r <= threshold) {
                fp++;
            } else {
                tn++;
            }
            ipnBad += ipn(r, tau);
        }
        double meanGood = goodRatios.length == 0 ? 0.0 : ipnGood / goodRatios.length;
        double meanBad = badRatios.length == 0 ? 0.0 : ipnBad / badRatios.length;
        return new TauCurvePoint(tau, threshold, tp, fn, tn, fp, meanGood, meanBad);
    }

    private static double ipn(double ratio, double tau) {
        return IpnCalculator.clamp(100.0 * (1.0 - ratio / tau), 0.0, 100.0);
    }

    public double[] getGoodRatios() {
        return goodRatios.clone();
    }

    public double[] getBadRatios() {
        return badRatios.clone();
    }

    public double getAcceptIpn() {
        return acceptIpn;
    }
}
