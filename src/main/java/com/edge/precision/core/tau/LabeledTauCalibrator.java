package com.edge.precision.core.tau;

import com.edge.precision.exception.TauConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 标注模式：在候选网格上为好/坏两组报告打分，按策略约束筛选可行点并按目标函数选优
 * <p>
 * 无可行点时返回约束未满足的最佳近似结果，由调用方决定是否作为失败处理
 */
public class LabeledTauCalibrator {
    private static final Logger logger = LoggerFactory.getLogger(LabeledTauCalibrator.class);

    public static final String NO_FEASIBLE_POINTS = "no_feasible_points_for_constraints";

    public LabeledCalibration calibrate(List<TauReport> good, List<TauReport> bad, double acceptIpn,
                                        LabeledPolicy policy, double tauMin, double tauMax,
                                        int maxPoints, boolean preferMm) {
        TauRanges.requireIpn("accept-ipn", acceptIpn);
        TauRanges.requireTauRange(tauMin, tauMax);
        TauRanges.requireMaxPoints(maxPoints);

        List<TauReport> all = new ArrayList<>(good);
        all.addAll(bad);
        TauUnits units = TauUnits.choose(all, preferMm);
        List<TauReport> usableGood = units == null ? List.of()
            : good.stream().filter(r -> r.supports(units)).collect(Collectors.toList());
        List<TauReport> usableBad = units == null ? List.of()
            : bad.stream().filter(r -> r.supports(units)).collect(Collectors.toList());
        if (usableGood.isEmpty() || usableBad.isEmpty()) {
            throw new TauConfigurationException(String.format(
                "Labeled tau calibration needs valid good and bad reports (good=%d, bad=%d)",
                usableGood.size(), usableBad.size()));
        }

        double[] goodRatios = usableGood.stream().mapToDouble(r -> r.ratio(units)).toArray();
        double[] badRatios = usableBad.stream().mapToDouble(r -> r.ratio(units)).toArray();
        LabeledScorer scorer = new LabeledScorer(goodRatios, badRatios, acceptIpn);

        double[] combined = new double[goodRatios.length + badRatios.length];
        System.arraycopy(goodRatios, 0, combined, 0, goodRatios.length);
        System.arraycopy(badRatios, 0, combined, goodRatios.length, badRatios.length);
        double[] grid = TauSearch.candidateGrid(combined, scorer.acceptFactor(), tauMin, tauMax, maxPoints);
        TauCurve curve = new TauCurve(grid, scorer);

        TauCurvePoint bestFeasible = null;
        TauCurvePoint bestOverall = null;
        int feasible = 0;
        for (TauCurvePoint point : curve) {
            if (bestOverall == null || policy.getObjective().ranking().compare(point, bestOverall) < 0) {
                bestOverall = point;
            }
            if (policy.isSatisfiedBy(point)) {
                feasible++;
                if (bestFeasible == null || policy.getObjective().ranking().compare(point, bestFeasible) < 0) {
                    bestFeasible = point;
                }
            }
        }

        TauCalibrationResult result = new TauCalibrationResult();
        result.setMode(TauCalibrationMode.LABELED.getCode());
        result.setUnits(units.getCode());
        result.setTauMin(tauMin);
        result.setTauMax(tauMax);
        result.setAcceptIpn(acceptIpn);
        result.setPolicy(policy.getName());
        result.setObjective(policy.getObjective().getCode());
        result.setConstraints(policy.constraints());
        result.setFeasiblePoints(feasible);
        result.setGridPoints(grid.length);
        result.setGoodCount(usableGood.size());
        result.setBadCount(usableBad.size());
        result.setGoodReportPaths(usableGood.stream().map(r -> r.getPath().toString()).collect(Collectors.toList()));
        result.setBadReportPaths(usableBad.stream().map(r -> r.getPath().toString()).collect(Collectors.toList()));

        if (bestFeasible != null) {
            result.applyPoint(bestFeasible);
            result.setConstraintsSatisfied(true);
            logger.info("Labeled tau calibration: tau={}, policy={}, ba={}, tpr={}, tnr={}, feasible={}/{}",
                bestFeasible.getTau(), policy.getName(), bestFeasible.getBalancedAccuracy(),
                bestFeasible.getTpr(), bestFeasible.getTnr(), feasible, grid.length);
        } else {
            result.applyPoint(bestOverall);
            result.setConstraintsSatisfied(false);
            result.setFallbackReason(NO_FEASIBLE_POINTS);
            logger.warn("Labeled tau calibration: no grid point satisfies policy {}, best effort tau={} violates {}",
                policy.getName(), bestOverall.getTau(), policy.violations(bestOverall));
        }
        return new LabeledCalibration(result, curve);
    }
}
