package com.edge.precision.service;

import com.edge.precision.config.PrecisionConfig;
import com.edge.precision.core.calibration.ScaleCalibration;
import com.edge.precision.core.calibration.ScaleCalibrator;
import com.edge.precision.core.distance.DistanceField;
import com.edge.precision.core.distance.DistanceFieldBuilder;
import com.edge.precision.core.distance.NearestNeighborValidator;
import com.edge.precision.core.extract.ContourExtractor;
import com.edge.precision.core.extract.ExtractionResult;
import com.edge.precision.core.metrics.MetricsEngine;
import com.edge.precision.core.metrics.MetricsResult;
import com.edge.precision.core.model.ResampledContour;
import com.edge.precision.core.registration.RegistrationCandidate;
import com.edge.precision.core.registration.RegistrationChain;
import com.edge.precision.core.registration.RegistrationInput;
import com.edge.precision.core.registration.RegistrationSelector;
import com.edge.precision.core.registration.SelectedRegistration;
import com.edge.precision.core.resample.ContourResampler;
import com.edge.precision.core.resample.SamplingPolicy;
import com.edge.precision.core.tau.TauCalibrationResult;
import com.edge.precision.dto.ComparisonReport;
import com.edge.precision.dto.ComparisonRequest;
import com.edge.precision.exception.ExtractionFailureException;
import com.edge.precision.exception.TauConfigurationException;
import com.edge.precision.repository.ReportRepository;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 切割精度比对服务
 * <p>
 * 流程：(可选) tau 自动标定 -> 读图 -> 轮廓提取 -> 重采样 -> 距离场 -> 配准候选与选择
 * -> 实测轮廓变换并重采样 -> 比例标定 -> 指标 -> 报告
 */
@Service
public class CutPrecisionService {
    private static final Logger logger = LoggerFactory.getLogger(CutPrecisionService.class);

    private static final DateTimeFormatter RUN_ID_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    private final PrecisionConfig config;
    private final ContourExtractor contourExtractor;
    private final ContourResampler resampler;
    private final DistanceFieldBuilder distanceFieldBuilder;
    private final NearestNeighborValidator validator;
    private final RegistrationChain registrationChain;
    private final RegistrationSelector registrationSelector;
    private final ScaleCalibrator scaleCalibrator;
    private final TauCalibrationService tauCalibrationService;
    private final ReportRepository reportRepository;

    @Autowired
    public CutPrecisionService(PrecisionConfig config, ContourExtractor contourExtractor, ContourResampler resampler,
                               DistanceFieldBuilder distanceFieldBuilder, NearestNeighborValidator validator,
                               RegistrationChain registrationChain, RegistrationSelector registrationSelector,
                               ScaleCalibrator scaleCalibrator, TauCalibrationService tauCalibrationService,
                               ReportRepository reportRepository) {
        this.config = config;
        this.contourExtractor = contourExtractor;
        this.resampler = resampler;
        this.distanceFieldBuilder = distanceFieldBuilder;
        this.validator = validator;
        this.registrationChain = registrationChain;
        this.registrationSelector = registrationSelector;
        this.scaleCalibrator = scaleCalibrator;
        this.tauCalibrationService = tauCalibrationService;
        this.reportRepository = reportRepository;
    }

    /**
     * 完整比对：读图、提取、比对并写出报告
     *
     * @throws ExtractionFailureException 任一图像提取不到轮廓，失败报告 (status=failed) 已写出
     */
    public ComparisonReport run(ComparisonRequest request) {
        Instant startedAt = Instant.now();
        String runId = RUN_ID_FORMAT.format(startedAt) + "-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("runId", runId);
        Path outputDir = request.getOutputDir() != null ? request.getOutputDir() : Paths.get("out", runId);

        Mat idealImage = null;
        Mat realImage = null;
        try {
            logger.info("Starting cut precision run: template={}, test={}", request.getTemplateImage(), request.getTestImage());

            // 1. tau 来源
            TauCalibrationResult tauResult = timed("tau_resolution", () -> resolveTau(request));
            double tau = tauResult != null ? tauResult.getTau()
                : (request.getTau() != null ? request.getTau() : config.getMetrics().getTau());

            // 2. 读图与轮廓提取
            idealImage = Imgcodecs.imread(request.getTemplateImage().toString());
            realImage = Imgcodecs.imread(request.getTestImage().toString());
            ExtractionResult idealExtraction = extract(idealImage, "template");
            ExtractionResult realExtraction = extract(realImage, "test");

            ComparisonReport report = new ComparisonReport();
            report.setRunId(runId);
            report.setTimestampUtc(startedAt);
            report.getInputs().put("template", request.getTemplateImage().toString());
            report.getInputs().put("test", request.getTestImage().toString());

            if (!idealExtraction.isSuccess() || !realExtraction.isSuccess()) {
                ExtractionFailureException failure = !idealExtraction.isSuccess()
                    ? new ExtractionFailureException("template", idealExtraction.getReason())
                    : new ExtractionFailureException("test", realExtraction.getReason());
                logger.error("Run {} failed: {}", runId, failure.getMessage());
                report.setStatus(ComparisonReport.STATUS_FAILED);
                Map<String, ComparisonReport.StageStatus> stages = new LinkedHashMap<>();
                stages.put("template_extraction", new ComparisonReport.StageStatus(idealExtraction.isSuccess(), idealExtraction.getReason()));
                stages.put("test_extraction", new ComparisonReport.StageStatus(realExtraction.isSuccess(), realExtraction.getReason()));
                report.setStages(stages);
                report.getArtifacts().put("report_json", outputDir.resolve(ReportRepository.REPORT_FILE).toString());
                reportRepository.saveReport(outputDir, report);
                throw failure;
            }

            // 3. 核心比对
            ComparisonInput input = new ComparisonInput();
            input.setIdealContour(idealExtraction.getContour());
            input.setRealContour(realExtraction.getContour());
            input.setIdealImage(idealImage);
            input.setRealImage(realImage);
            input.setWidth(idealImage.cols());
            input.setHeight(idealImage.rows());
            input.setTau(tau);
            input.setSamplingPolicy(samplingPolicy(request));
            input.setManualMmPerPx(request.getManualMmPerPx());
            input.setValidateWithKdtree(request.getValidateWithKdtree());
            ComparisonOutcome outcome = compare(input);

            // 4. 报告
            ComparisonReport filled = ComparisonReportAssembler.assemble(report, outcome, config, tauResult, tau);
            filled.setStatus(ComparisonReport.STATUS_OK);
            Path distancesFile = reportRepository.saveDistances(outputDir, outcome.getMetrics().getPointDistances());
            filled.getArtifacts().put("distances_csv", distancesFile.toString());
            filled.getArtifacts().put("report_json", outputDir.resolve(ReportRepository.REPORT_FILE).toString());
            reportRepository.saveReport(outputDir, filled);

            logger.info("Run {} finished in {} ms: ipn={}, mad={}px, registration={}{}", runId,
                System.currentTimeMillis() - startedAt.toEpochMilli(), outcome.getMetrics().getIpn(),
                outcome.getMetrics().getMadPx(), outcome.getRegistration().getMethod().getCode(),
                outcome.getRegistration().isDegraded() ? " (degraded)" : "");
            return filled;
        } finally {
            if (idealImage != null) idealImage.release();
            if (realImage != null) realImage.release();
            MDC.remove("runId");
        }
    }

    /**
     * 核心比对：不读写文件，不修改输入
     */
    public ComparisonOutcome compare(ComparisonInput input) {
        SamplingPolicy policy = input.getSamplingPolicy() != null
            ? input.getSamplingPolicy()
            : SamplingPolicy.from(config.getSampling());

        ResampledContour idealResampled = timed("resample_ideal", () -> resampler.resample(input.getIdealContour(), policy));
        ResampledContour realResampled = timed("resample_real", () -> resampler.resample(input.getRealContour(), policy));

        DistanceField field = timed("distance_field",
            () -> distanceFieldBuilder.build(idealResampled, input.getWidth(), input.getHeight()));

        SelectedRegistration registration = timed("registration", () -> {
            List<RegistrationCandidate> candidates = registrationChain.produceAll(
                new RegistrationInput(input.getIdealImage(), input.getRealImage()));
            return registrationSelector.select(candidates, realResampled, field);
        });

        // 变换原始实测轮廓后重新采样
        ResampledContour realAligned = timed("resample_aligned",
            () -> resampler.resample(registration.getTransform().apply(input.getRealContour()), policy));

        ScaleCalibration calibration = timed("calibration",
            () -> scaleCalibrator.calibrate(input.getIdealImage(), input.getManualMmPerPx()));

        MetricsEngine engine = metricsEngine(input.getValidateWithKdtree());
        MetricsResult metrics = timed("metrics",
            () -> engine.compute(idealResampled, realAligned, field, calibration, input.getTau()));

        return new ComparisonOutcome(idealResampled, realAligned, registration, calibration, metrics);
    }

    private TauCalibrationResult resolveTau(ComparisonRequest request) {
        if (request.getTauCalibration() == null) {
            return null;
        }
        if (request.getTau() != null) {
            throw new TauConfigurationException("A fixed tau and automatic tau calibration cannot be combined");
        }
        TauCalibrationResult result = tauCalibrationService.calibrate(request.getTauCalibration());
        logger.info("Tau resolved automatically: mode={}, tau={}", result.getMode(), result.getTau());
        return result;
    }

    private ExtractionResult extract(Mat image, String stage) {
        if (image == null || image.empty()) {
            logger.error("Unable to read {} image", stage);
            return ExtractionResult.failure("image_unreadable");
        }
        return timed(stage + "_extraction", () -> contourExtractor.extract(image));
    }

    private SamplingPolicy samplingPolicy(ComparisonRequest request) {
        PrecisionConfig.SamplingConfig sampling = config.getSampling();
        Integer numPoints = request.getNumPoints() != null ? request.getNumPoints() : sampling.getNumPoints();
        if (numPoints != null) {
            return SamplingPolicy.byCount(numPoints, sampling.getMaxPoints());
        }
        double step = request.getStepPx() != null ? request.getStepPx() : sampling.getStepPx();
        return SamplingPolicy.byStep(step, sampling.getMaxPoints());
    }

    private MetricsEngine metricsEngine(Boolean validateOverride) {
        PrecisionConfig.DistanceConfig distance = config.getDistance();
        if (validateOverride != null && validateOverride != distance.isValidateWithKdtree()) {
            PrecisionConfig.DistanceConfig copy = new PrecisionConfig.DistanceConfig();
            copy.setDrawThickness(distance.getDrawThickness());
            copy.setUseBilinear(distance.isUseBilinear());
            copy.setValidationTolerancePx(distance.getValidationTolerancePx());
            copy.setValidateWithKdtree(validateOverride);
            distance = copy;
        }
        return new MetricsEngine(distance, config.getMetrics(), validator);
    }

    private static <T> T timed(String stage, Supplier<T> action) {
        long start = System.currentTimeMillis();
        logger.debug("Stage {} started", stage);
        T result = action.get();
        logger.info("Stage {} finished in {} ms", stage, System.currentTimeMillis() - start);
        return result;
    }
}
