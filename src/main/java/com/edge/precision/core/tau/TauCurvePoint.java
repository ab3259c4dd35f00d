package com.edge.precision.core.tau;

/**
 * 标注模式下某个 tau 的分类评分
 */
public class TauCurvePoint {
    private final double tau;
    private final double thresholdRatio;
    private final int tp;
    private final int fn;
    private final int tn;
    private final int fp;
    private final double meanIpnGood;
    private final double meanIpnBad;

    public TauCurvePoint(double tau, double thresholdRatio, int tp, int fn, int tn, int fp,
                         double meanIpnGood, double meanIpnBad) {
        this.tau = tau;
        this.thresholdRatio = thresholdRatio;
        this.tp = tp;
        this.fn = fn;
        this.tn = tn;
        this.fp = fp;
        this.meanIpnGood = meanIpnGood;
        this.meanIpnBad = meanIpnBad;
    }

    public double getTau() { return tau; }

    public double getThresholdRatio() { return thresholdRatio; }

    public int getTp() { return tp; }

    public int getFn() { return fn; }

    public int getTn() { return tn; }

    public int getFp() { return fp; }

    public double getTpr() {
        return tp + fn == 0 ? 0.0 : (double) tp / (tp + fn);
    }

    public double getTnr() {
        return tn + fp == 0 ? 0.0 : (double) tn / (tn + fp);
    }

    public double getFpr() {
        return tn + fp == 0 ? 0.0 : (double) fp / (tn + fp);
    }

    public double getBalancedAccuracy() {
        return (getTpr() + getTnr()) / 2.0;
    }

    public double getMeanIpnGood() { return meanIpnGood; }

    public double getMeanIpnBad() { return meanIpnBad; }

    public double getMeanIpnGap() {
        return meanIpnGood - meanIpnBad;
    }

    @Override
    public String toString() {
        return String.format("TauCurvePoint[tau=%.6f, ba=%.4f, tpr=%.4f, tnr=%.4f, gap=%.2f]",
            tau, getBalancedAccuracy(), getTpr(), getTnr(), getMeanIpnGap());
    }
}
