package com.edge.precision.service;

import com.edge.precision.config.PrecisionConfig;
import com.edge.precision.core.calibration.ScaleCalibration;
import com.edge.precision.core.distance.DistanceValidation;
import com.edge.precision.core.distance.ValidationStatus;
import com.edge.precision.core.metrics.ContourDiagnostics;
import com.edge.precision.core.metrics.MetricsResult;
import com.edge.precision.core.registration.CandidateEvaluation;
import com.edge.precision.core.registration.RegistrationCandidate;
import com.edge.precision.core.registration.SelectedRegistration;
import com.edge.precision.core.tau.TauCalibrationMode;
import com.edge.precision.core.tau.TauCalibrationResult;
import com.edge.precision.dto.ComparisonReport;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 由比对结果组装报告各块
 */
final class ComparisonReportAssembler {

    private ComparisonReportAssembler() {
    }

    static ComparisonReport assemble(ComparisonReport report, ComparisonOutcome outcome, PrecisionConfig config,
                                     TauCalibrationResult tauResult, double tau) {
        report.setRegistration(registration(outcome.getRegistration()));
        report.setCalibration(calibration(outcome.getCalibration()));
        report.setDistanceMethod(distanceMethod(outcome.getMetrics(), config));
        report.setDiagnostics(diagnostics(outcome));
        report.setMetrics(metrics(outcome.getMetrics()));

        ComparisonReport.TauCalibrationBlock tauBlock = new ComparisonReport.TauCalibrationBlock();
        tauBlock.setMode(tauResult == null ? TauCalibrationMode.FIXED.getCode() : tauResult.getMode());
        tauBlock.setTauUsed(tau);
        tauBlock.setResult(tauResult);
        report.setTauCalibration(tauBlock);

        Map<String, Object> configBlock = new LinkedHashMap<>();
        configBlock.put("sampling", config.getSampling());
        configBlock.put("distance", config.getDistance());
        configBlock.put("metrics", config.getMetrics());
        configBlock.put("registration", config.getRegistration());
        configBlock.put("calibration", config.getCalibration());
        configBlock.put("extraction", config.getExtraction());
        report.setConfig(configBlock);
        return report;
    }

    private static ComparisonReport.RegistrationBlock registration(SelectedRegistration selected) {
        ComparisonReport.RegistrationBlock block = new ComparisonReport.RegistrationBlock();
        RegistrationCandidate chosen = selected.getSelected();
        block.setStatus(selected.isDegraded() ? "degraded" : "ok");
        block.setMethod(chosen.getMethod().getCode());
        block.setSelectionMadPx(Double.isFinite(selected.getTrialMadPx()) ? selected.getTrialMadPx() : null);
        block.setInlierRatio(chosen.getInlierRatio());
        block.setReprojectionErrorPx(chosen.getReprojectionErrorPx());
        block.setMatchesUsed(chosen.getMatchesUsed());
        block.setTransform(chosen.getTransform().toRows());
        for (CandidateEvaluation evaluation : selected.getEvaluations()) {
            RegistrationCandidate c = evaluation.getCandidate();
            ComparisonReport.CandidateRow row = new ComparisonReport.CandidateRow();
            row.setMethod(c.getMethod().getCode());
            row.setValid(c.isValid());
            row.setReason(c.getFailureReason());
            row.setMatchesTotal(c.getMatchesTotal());
            row.setMatchesUsed(c.getMatchesUsed());
            row.setInlierRatio(c.getInlierRatio());
            row.setReprojectionErrorPx(c.getReprojectionErrorPx());
            row.setConverged(c.getConverged());
            row.setCorrelation(c.getCorrelation());
            row.setSelectionMadPx(evaluation.getTrialMadPx());
            block.getCandidates().add(row);
        }
        return block;
    }

    private static ComparisonReport.CalibrationBlock calibration(ScaleCalibration calibration) {
        ComparisonReport.CalibrationBlock block = new ComparisonReport.CalibrationBlock();
        block.setStatus(calibration.getStatus().getCode());
        block.setMethod(calibration.getMethod());
        block.setMmPerPx(calibration.getMmPerPx());
        block.getDetails().putAll(calibration.getDetails());
        return block;
    }

    private static ComparisonReport.DistanceMethodBlock distanceMethod(MetricsResult metrics, PrecisionConfig config) {
        DistanceValidation validation = metrics.getValidation();
        ComparisonReport.DistanceMethodBlock block = new ComparisonReport.DistanceMethodBlock();
        block.setValidation(validation.getStatus() == ValidationStatus.SKIPPED ? "disabled" : "kdtree");
        block.setValidationStatus(validation.getStatus().getCode());
        block.setValidationTolerancePx(validation.getTolerancePx());
        block.setFieldMadPx(validation.getFieldMadPx());
        block.setValidatorMadPx(validation.getValidatorMadPx());
        block.setMadDeltaPx(validation.getMadDeltaPx());
        block.setMeanAbsDeltaPx(validation.getMeanAbsDeltaPx());
        block.setBilinear(config.getDistance().isUseBilinear());
        block.setClampedSamples(metrics.getClampedSamples());
        return block;
    }

    private static ComparisonReport.DiagnosticsBlock diagnostics(ComparisonOutcome outcome) {
        ContourDiagnostics d = outcome.getMetrics().getDiagnostics();
        ScaleCalibration calibration = outcome.getCalibration();
        ComparisonReport.DiagnosticsBlock block = new ComparisonReport.DiagnosticsBlock();
        block.setMadRealToIdealPx(d.getMadRealToIdealPx());
        block.setMadIdealToRealPx(d.getMadIdealToRealPx());
        block.setBidirectionalMadPx(d.getBidirectionalMadPx());
        block.setHausdorffPx(d.getHausdorffPx());
        block.setMadRealToIdealMm(calibration.toMm(d.getMadRealToIdealPx()));
        block.setMadIdealToRealMm(calibration.toMm(d.getMadIdealToRealPx()));
        block.setBidirectionalMadMm(calibration.toMm(d.getBidirectionalMadPx()));
        block.setHausdorffMm(calibration.toMm(d.getHausdorffPx()));
        block.setIdealPoints(outcome.getIdealResampled().size());
        block.setRealPoints(outcome.getRealAligned().size());
        return block;
    }

    private static ComparisonReport.MetricsBlock metrics(MetricsResult m) {
        ComparisonReport.MetricsBlock block = new ComparisonReport.MetricsBlock();
        block.setMadPx(m.getMadPx());
        block.setStdPx(m.getStdPx());
        block.setP95Px(m.getP95Px());
        block.setMaxPx(m.getMaxPx());
        block.setMadMm(m.getMadMm());
        block.setStdMm(m.getStdMm());
        block.setP95Mm(m.getP95Mm());
        block.setMaxMm(m.getMaxMm());
        block.setScalePx(m.getScalePx());
        block.setScaleMm(m.getScaleMm());
        block.setTau(m.getTau());
        block.setTolerancePx(m.getTolerancePx());
        block.setToleranceMm(m.getToleranceMm());
        block.setIpnPx(m.getIpnPx());
        block.setIpnMm(m.getIpnMm());
        block.setIpn(m.getIpn());
        block.setMetricsStatus(m.getStatus().getCode());
        return block;
    }
}
