package com.edge.precision.runner;

import com.edge.precision.core.tau.TauCalibrationRequest;
import com.edge.precision.core.tau.TauCalibrationResult;
import com.edge.precision.dto.ComparisonReport;
import com.edge.precision.dto.ComparisonRequest;
import com.edge.precision.exception.ExtractionFailureException;
import com.edge.precision.exception.PrecisionException;
import com.edge.precision.exception.TauSearchExhaustedException;
import com.edge.precision.service.CutPrecisionService;
import com.edge.precision.service.TauCalibrationService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * 命令行入口
 * <p>
 * 两个子命令：
 * <pre>
 *   compare --template=ideal.png --test=real.png [--out=dir] [--tau=0.02] ...
 *   tau     --tau-reports=glob ... | --good-reports=glob --bad-reports=glob ...
 * </pre>
 * 退出码：0 成功，1 参数/标定错误，2 轮廓提取失败
 */
@Component
public class PrecisionCommandRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger logger = LoggerFactory.getLogger(PrecisionCommandRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_EXTRACTION_FAILED = 2;

    static final String USAGE = String.join(System.lineSeparator(),
        "Usage:",
        "  compare --template=<image> --test=<image> [--out=<dir>] [--tau=<t>] [--step-px=<s>] [--num-points=<n>]",
        "          [--manual-mm-per-px=<v>] [--no-kd-validate]",
        "          [--tau-auto-reports=<glob> --target-ipn=<v> --statistic=mean|median|p75]",
        "          [--tau-auto-good-reports=<glob> --tau-auto-bad-reports=<glob> --tau-auto-policy=<p>]",
        "  tau     --tau-reports=<glob> [--target-ipn=<v>] [--statistic=<s>]",
        "          | --good-reports=<glob> --bad-reports=<glob> [--accept-ipn=<v>] [--policy=strict|balanced|lenient|custom]",
        "            [--objective=<o>] [--max-mean-ipn-bad=<v>] [--min-mean-ipn-gap=<v>] [--min-tpr=<v>] [--min-tnr=<v>]",
        "            [--curve-csv=<file>] [--curve-png=<file>] [--curve-max-points=<n>]",
        "          [--tau-min=<v>] [--tau-max=<v>] [--prefer-px]");

    private final CutPrecisionService cutPrecisionService;
    private final TauCalibrationService tauCalibrationService;
    private final ObjectMapper objectMapper;

    private int exitCode = EXIT_OK;

    @Autowired
    public PrecisionCommandRunner(CutPrecisionService cutPrecisionService, TauCalibrationService tauCalibrationService,
                                  ObjectMapper objectMapper) {
        this.cutPrecisionService = cutPrecisionService;
        this.tauCalibrationService = tauCalibrationService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            logger.info("No command given{}{}", System.lineSeparator(), USAGE);
            return;
        }
        String command = commands.get(0);
        try {
            switch (command) {
                case "compare" -> runCompare(args);
                case "tau" -> runTau(args);
                default -> {
                    logger.error("Unknown command: {}{}{}", command, System.lineSeparator(), USAGE);
                    exitCode = EXIT_FAILURE;
                }
            }
        } catch (ExtractionFailureException e) {
            logger.error("Contour extraction failed: {}", e.getMessage());
            exitCode = EXIT_EXTRACTION_FAILED;
        } catch (TauSearchExhaustedException e) {
            logger.error("Tau calibration failed: {} (best effort tau={})", e.getMessage(), e.getBestEffortTau());
            printJson(e.getBestEffortResult());
            exitCode = EXIT_FAILURE;
        } catch (PrecisionException | IllegalArgumentException e) {
            logger.error("Run failed: {}", e.getMessage());
            exitCode = EXIT_FAILURE;
        } catch (UncheckedIOException e) {
            logger.error("I/O error: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void runCompare(ApplicationArguments args) {
        ComparisonRequest request = new ComparisonRequest();
        request.setTemplateImage(requiredPath(args, "template"));
        request.setTestImage(requiredPath(args, "test"));
        request.setOutputDir(optionalPath(args, "out"));
        request.setTau(optionalDouble(args, "tau"));
        request.setStepPx(optionalDouble(args, "step-px"));
        request.setNumPoints(optionalInteger(args, "num-points"));
        request.setManualMmPerPx(optionalDouble(args, "manual-mm-per-px"));
        if (args.containsOption("no-kd-validate")) {
            request.setValidateWithKdtree(false);
        }

        List<String> autoReports = values(args, "tau-auto-reports");
        List<String> autoGood = values(args, "tau-auto-good-reports");
        List<String> autoBad = values(args, "tau-auto-bad-reports");
        if (!autoReports.isEmpty() || !autoGood.isEmpty() || !autoBad.isEmpty()) {
            TauCalibrationRequest tau = new TauCalibrationRequest();
            tau.setReportPatterns(autoReports);
            tau.setGoodPatterns(autoGood);
            tau.setBadPatterns(autoBad);
            tau.setTargetIpn(optionalDouble(args, "target-ipn"));
            tau.setStatistic(optional(args, "statistic"));
            tau.setAcceptIpn(optionalDouble(args, "accept-ipn"));
            tau.setPolicy(optional(args, "tau-auto-policy"));
            applyCommonTauOptions(args, tau);
            request.setTauCalibration(tau);
        }

        ComparisonReport report = cutPrecisionService.run(request);
        logger.info("Report written to {}", report.getArtifacts().get("report_json"));
        printJson(report.getMetrics());
    }

    private void runTau(ApplicationArguments args) {
        TauCalibrationRequest request = new TauCalibrationRequest();
        request.setReportPatterns(values(args, "tau-reports"));
        request.setTargetIpn(optionalDouble(args, "target-ipn"));
        request.setStatistic(optional(args, "statistic"));

        request.setGoodPatterns(values(args, "good-reports"));
        request.setBadPatterns(values(args, "bad-reports"));
        request.setAcceptIpn(optionalDouble(args, "accept-ipn"));
        request.setPolicy(optional(args, "policy"));
        request.setObjective(optional(args, "objective"));
        request.setMaxMeanIpnBad(optionalDouble(args, "max-mean-ipn-bad"));
        request.setMinMeanIpnGap(optionalDouble(args, "min-mean-ipn-gap"));
        request.setMinTpr(optionalDouble(args, "min-tpr"));
        request.setMinTnr(optionalDouble(args, "min-tnr"));
        request.setCurveCsv(optionalPath(args, "curve-csv"));
        request.setCurvePng(optionalPath(args, "curve-png"));
        request.setCurveMaxPoints(optionalInteger(args, "curve-max-points"));
        applyCommonTauOptions(args, request);

        TauCalibrationResult result = tauCalibrationService.calibrate(request);
        logger.info("Calibrated tau={} ({}, units={})", result.getTau(), result.getMode(), result.getUnits());
        printJson(result);
    }

    private static void applyCommonTauOptions(ApplicationArguments args, TauCalibrationRequest request) {
        request.setTauMin(optionalDouble(args, "tau-min"));
        request.setTauMax(optionalDouble(args, "tau-max"));
        if (args.containsOption("prefer-px")) {
            request.setPreferMm(false);
        }
    }

    private void printJson(Object value) {
        if (value == null) {
            return;
        }
        try {
            System.out.println(objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            logger.warn("Failed to serialize result: {}", e.getMessage());
        }
    }

    // --- 参数解析 ---

    static List<String> values(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        List<String> result = new ArrayList<>();
        if (values == null) {
            return result;
        }
        for (String value : values) {
            for (String part : value.split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }

    static String optional(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    static Double optionalDouble(ApplicationArguments args, String name) {
        String value = optional(args, name);
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option --" + name + " expects a number, got: " + value);
        }
    }

    static Integer optionalInteger(ApplicationArguments args, String name) {
        String value = optional(args, name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option --" + name + " expects an integer, got: " + value);
        }
    }

    private static Path optionalPath(ApplicationArguments args, String name) {
        String value = optional(args, name);
        return value == null ? null : Paths.get(value);
    }

    private static Path requiredPath(ApplicationArguments args, String name) {
        Path path = optionalPath(args, name);
        if (path == null) {
            throw new IllegalArgumentException("Missing required option --" + name);
        }
        return path;
    }
}
