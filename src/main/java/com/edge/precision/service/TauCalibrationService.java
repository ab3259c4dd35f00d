package com.edge.precision.service;

import com.edge.precision.config.PrecisionConfig;
import com.edge.precision.core.tau.LabeledCalibration;
import com.edge.precision.core.tau.LabeledPolicy;
import com.edge.precision.core.tau.LabeledTauCalibrator;
import com.edge.precision.core.tau.ReportLoader;
import com.edge.precision.core.tau.ReportPathCollector;
import com.edge.precision.core.tau.TargetTauCalibrator;
import com.edge.precision.core.tau.TauCalibrationRequest;
import com.edge.precision.core.tau.TauCalibrationResult;
import com.edge.precision.core.tau.TauCurveExporter;
import com.edge.precision.core.tau.TauObjective;
import com.edge.precision.core.tau.TauPolicy;
import com.edge.precision.core.tau.TauReport;
import com.edge.precision.core.tau.TauStatistic;
import com.edge.precision.exception.TauConfigurationException;
import com.edge.precision.exception.TauSearchExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * tau 标定服务
 * <p>
 * 目标模式与标注模式互斥；曲线导出仅在标注模式下可用。
 * 参数缺省值取自 cut-precision.tau 配置
 */
@Service
public class TauCalibrationService {
    private static final Logger logger = LoggerFactory.getLogger(TauCalibrationService.class);

    private final PrecisionConfig config;
    private final ReportPathCollector pathCollector;
    private final ReportLoader reportLoader;
    private final TargetTauCalibrator targetCalibrator;
    private final LabeledTauCalibrator labeledCalibrator;
    private final TauCurveExporter curveExporter;

    @Autowired
    public TauCalibrationService(PrecisionConfig config, ReportPathCollector pathCollector, ReportLoader reportLoader,
                                 TargetTauCalibrator targetCalibrator, LabeledTauCalibrator labeledCalibrator,
                                 TauCurveExporter curveExporter) {
        this.config = config;
        this.pathCollector = pathCollector;
        this.reportLoader = reportLoader;
        this.targetCalibrator = targetCalibrator;
        this.labeledCalibrator = labeledCalibrator;
        this.curveExporter = curveExporter;
    }

    public TauCalibrationResult calibrate(TauCalibrationRequest request) {
        validateMode(request);
        if (request.hasTargetInputs()) {
            return calibrateTarget(request);
        }
        return calibrateLabeled(request);
    }

    /**
     * 模式互斥与完整性校验
     */
    void validateMode(TauCalibrationRequest request) {
        boolean target = request.hasTargetInputs();
        boolean labeled = request.hasLabeledInputs();
        if (target && labeled) {
            throw new TauConfigurationException("Target mode (report patterns) and labeled mode (good/bad patterns) are mutually exclusive");
        }
        if (!target && !labeled) {
            throw new TauConfigurationException("No reports supplied: give report patterns or good and bad report patterns");
        }
        if (labeled && (isEmpty(request.getGoodPatterns()) || isEmpty(request.getBadPatterns()))) {
            throw new TauConfigurationException("Labeled mode needs both good and bad report patterns");
        }
        if (target && request.isCurveExportRequested()) {
            throw new TauConfigurationException("Curve export is only available in labeled mode");
        }
    }

    private TauCalibrationResult calibrateTarget(TauCalibrationRequest request) {
        PrecisionConfig.TauConfig defaults = config.getTau();
        List<TauReport> reports = load(request.getReportPatterns(), "target");
        double target = valueOr(request.getTargetIpn(), defaults.getTargetIpn());
        TauStatistic statistic = TauStatistic.fromName(request.getStatistic() != null ? request.getStatistic() : defaults.getStatistic());
        return targetCalibrator.calibrate(reports, target, statistic,
            valueOr(request.getTauMin(), defaults.getTauMin()),
            valueOr(request.getTauMax(), defaults.getTauMax()),
            preferMm(request));
    }

    private TauCalibrationResult calibrateLabeled(TauCalibrationRequest request) {
        PrecisionConfig.TauConfig defaults = config.getTau();
        List<TauReport> good = load(request.getGoodPatterns(), "good");
        List<TauReport> bad = load(request.getBadPatterns(), "bad");

        TauPolicy preset = TauPolicy.fromName(request.getPolicy() != null ? request.getPolicy() : defaults.getPolicy());
        TauObjective objective = request.getObjective() != null ? TauObjective.fromName(request.getObjective()) : null;
        LabeledPolicy policy = preset.preset().withOverrides(objective, request.getMaxMeanIpnBad(),
            request.getMinMeanIpnGap(), request.getMinTpr(), request.getMinTnr());

        LabeledCalibration calibration = labeledCalibrator.calibrate(good, bad,
            valueOr(request.getAcceptIpn(), defaults.getAcceptIpn()), policy,
            valueOr(request.getTauMin(), defaults.getTauMin()),
            valueOr(request.getTauMax(), defaults.getTauMax()),
            request.getCurveMaxPoints() != null ? request.getCurveMaxPoints() : defaults.getCurveMaxPoints(),
            preferMm(request));
        TauCalibrationResult result = calibration.getResult();

        if (request.isCurveExportRequested()) {
            exportCurve(calibration, request.getCurveCsv(), request.getCurvePng());
        }
        if (!calibration.isSatisfied()) {
            throw new TauSearchExhaustedException(String.format(
                "No tau in [%s, %s] satisfies policy %s", result.getTauMin(), result.getTauMax(), policy.getName()),
                result.getTau(), result);
        }
        return result;
    }

    private void exportCurve(LabeledCalibration calibration, Path csv, Path png) {
        TauCalibrationResult result = calibration.getResult();
        try {
            if (csv != null) {
                int rows = curveExporter.writeCsv(calibration.getCurve(), csv);
                result.setCurveCsv(csv.toString());
                result.setCurvePoints(rows);
            }
            if (png != null) {
                curveExporter.writePng(calibration.getCurve(), result.getTau(), png);
                result.setCurvePng(png.toString());
                result.setCurvePoints(calibration.getCurve().size());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export tau curve", e);
        }
    }

    private List<TauReport> load(List<String> patterns, String label) {
        List<Path> paths = pathCollector.collect(patterns);
        List<TauReport> reports = reportLoader.loadAll(paths);
        logger.info("Loaded {} valid {} reports from {} files", reports.size(), label, paths.size());
        if (reports.isEmpty()) {
            throw new TauConfigurationException("No valid " + label + " reports found for patterns " + patterns);
        }
        return reports;
    }

    private boolean preferMm(TauCalibrationRequest request) {
        return request.getPreferMm() != null ? request.getPreferMm() : config.getTau().isPreferMm();
    }

    private static double valueOr(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    private static boolean isEmpty(List<String> list) {
        return list == null || list.isEmpty();
    }
}
