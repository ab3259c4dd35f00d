package com.edge.precision.core.metrics;

/**
 * 双向诊断：实测->理想、理想->实测的有向 MAD，双向 MAD 与 Hausdorff 距离（像素）
 */
public class ContourDiagnostics {
    private final double madRealToIdealPx;
    private final double madIdealToRealPx;
    private final double bidirectionalMadPx;
    private final double hausdorffPx;

    public ContourDiagnostics(double madRealToIdealPx, double madIdealToRealPx, double hausdorffPx) {
        this.madRealToIdealPx = madRealToIdealPx;
        this.madIdealToRealPx = madIdealToRealPx;
        this.bidirectionalMadPx = (madRealToIdealPx + madIdealToRealPx) / 2.0;
        this.hausdorffPx = hausdorffPx;
    }

    /**
     * 由两个方向的逐点最近距离构建
     */
    public static ContourDiagnostics of(double[] realToIdeal, double[] idealToReal) {
        double hausdorff = Math.max(DistanceStatistics.max(realToIdeal), DistanceStatistics.max(idealToReal));
        return new ContourDiagnostics(DistanceStatistics.mean(realToIdeal), DistanceStatistics.mean(idealToReal), hausdorff);
    }

    public double getMadRealToIdealPx() { return madRealToIdealPx; }

    public double getMadIdealToRealPx() { return madIdealToRealPx; }

    public double getBidirectionalMadPx() { return bidirectionalMadPx; }

    public double getHausdorffPx() { return hausdorffPx; }

    @Override
    public String toString() {
        return String.format("ContourDiagnostics[r2i=%.4f, i2r=%.4f, bi=%.4f, hausdorff=%.4f]",
            madRealToIdealPx, madIdealToRealPx, bidirectionalMadPx, hausdorffPx);
    }
}
