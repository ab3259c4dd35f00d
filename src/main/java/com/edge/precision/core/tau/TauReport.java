package com.edge.precision.core.tau;

import java.nio.file.Path;

/**
 * 历史报告中用于 tau 标定的指标
 */
public class TauReport {
    private final Path path;
    private final Double madPx;
    private final Double scalePx;
    private final Double madMm;
    private final Double scaleMm;

    public TauReport(Path path, Double madPx, Double scalePx, Double madMm, Double scaleMm) {
        this.path = path;
        this.madPx = madPx;
        this.scalePx = scalePx;
        this.madMm = madMm;
        this.scaleMm = scaleMm;
    }

    public boolean supports(TauUnits units) {
        return units == TauUnits.MM ? valid(madMm, scaleMm) : valid(madPx, scalePx);
    }

    /**
     * 归一化偏差 mad / scale
     */
    public double ratio(TauUnits units) {
        if (!supports(units)) {
            throw new IllegalStateException("Report " + path + " has no " + units.getCode() + " metrics");
        }
        return units == TauUnits.MM ? madMm / scaleMm : madPx / scalePx;
    }

    private static boolean valid(Double mad, Double scale) {
        return mad != null && scale != null && Double.isFinite(mad) && Double.isFinite(scale) && mad >= 0 && scale > 0;
    }

    public Path getPath() { return path; }

    public Double getMadPx() { return madPx; }

    public Double getScalePx() { return scalePx; }

    public Double getMadMm() { return madMm; }

    public Double getScaleMm() { return scaleMm; }

    @Override
    public String toString() {
        return String.format("TauReport[%s, madPx=%s, scalePx=%s, madMm=%s, scaleMm=%s]", path, madPx, scalePx, madMm, scaleMm);
    }
}
