package com.edge.precision.core.tau;

import com.edge.precision.core.metrics.IpnCalculator;
import com.edge.precision.exception.TauConfigurationException;
import com.edge.precision.exception.TauSearchExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.DoubleUnaryOperator;
import java.util.stream.Collectors;

/**
 * 目标模式：二分搜索 tau 使逐报告 IPN 的统计量等于目标 IPN
 * <p>
 * 单报告 IPN 关于 tau 单调不减且连续，统计量（均值、中位数、P75）亦然
 */
public class TargetTauCalibrator {
    private static final Logger logger = LoggerFactory.getLogger(TargetTauCalibrator.class);

    private static final double IPN_TOLERANCE = 1e-6;

    public TauCalibrationResult calibrate(List<TauReport> reports, double targetIpn, TauStatistic statistic,
                                          double tauMin, double tauMax, boolean preferMm) {
        TauRanges.requireIpn("target-ipn", targetIpn);
        TauRanges.requireTauRange(tauMin, tauMax);

        TauUnits units = TauUnits.choose(reports, preferMm);
        List<TauReport> usable = units == null ? List.of()
            : reports.stream().filter(r -> r.supports(units)).collect(Collectors.toList());
        if (usable.isEmpty()) {
            throw new TauConfigurationException("No valid reports available for target tau calibration");
        }

        double[] ratios = usable.stream().mapToDouble(r -> r.ratio(units)).toArray();
        DoubleUnaryOperator aggregate = tau -> statistic.apply(ipnValues(ratios, tau));

        TauCalibrationResult result = new TauCalibrationResult();
        result.setMode(TauCalibrationMode.TARGET.getCode());
        result.setUnits(units.getCode());
        result.setTauMin(tauMin);
        result.setTauMax(tauMax);
        result.setTargetIpn(targetIpn);
        result.setStatistic(statistic.getCode());
        result.setReportCount(usable.size());
        result.setReportPaths(usable.stream().map(r -> r.getPath().toString()).collect(Collectors.toList()));
        double factor = 1.0 - targetIpn / 100.0;
        for (double ratio : ratios) {
            result.getPerReportTau().add(ratio / factor);
        }

        Double tau = TauSearch.bisect(aggregate, tauMin, tauMax, targetIpn, IPN_TOLERANCE);
        if (tau == null) {
            double boundary = aggregate.applyAsDouble(tauMax) < targetIpn ? tauMax : tauMin;
            result.setTau(boundary);
            result.setAchievedIpn(aggregate.applyAsDouble(boundary));
            result.setConstraintsSatisfied(false);
            result.setFallbackReason("target_unreachable_in_range");
            logger.error("Target IPN {} unreachable for tau in [{}, {}], best effort tau={}", targetIpn, tauMin, tauMax, boundary);
            throw new TauSearchExhaustedException(String.format(
                "Target %s IPN %.2f is not reachable for tau in [%s, %s]", statistic.getCode(), targetIpn, tauMin, tauMax),
                boundary, result);
        }

        result.setTau(tau);
        result.setAchievedIpn(aggregate.applyAsDouble(tau));
        logger.info("Target tau calibration: tau={} ({} {} IPN={}, {} reports, units={})",
            tau, statistic.getCode(), result.getAchievedIpn(), targetIpn, usable.size(), units.getCode());
        return result;
    }

    static double[] ipnValues(double[] ratios, double tau) {
        double[] values = new double[ratios.length];
        for (int i = 0; i < ratios.length; i++) {
            values[i] = IpnCalculator.clamp(100.0 * (1.0 - ratios[i] / tau), 0.0, 100.0);
        }
        return values;
    }
}
