package com.edge.precision.service;

import com.edge.precision.core.registration.RegistrationMethod;
import com.edge.precision.core.tau.TauCalibrationRequest;
import com.edge.precision.dto.ComparisonReport;
import com.edge.precision.dto.ComparisonRequest;
import com.edge.precision.exception.ExtractionFailureException;
import com.edge.precision.exception.TauConfigurationException;
import com.edge.precision.repository.ReportRepository;
import com.edge.precision.support.SyntheticImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest
class CutPrecisionServiceTest {

    @Autowired
    private CutPrecisionService service;

    @Autowired
    private ReportRepository reportRepository;

    @TempDir
    Path tempDir;

    @Test
    void compare_withoutImages_fallsBackToIdentity() {
        ComparisonInput input = new ComparisonInput();
        input.setIdealContour(SyntheticImages.square(100, 100, 100));
        input.setRealContour(SyntheticImages.square(100, 100, 100));
        input.setWidth(300);
        input.setHeight(300);
        input.setTau(0.02);

        ComparisonOutcome outcome = service.compare(input);

        assertThat(outcome.getRegistration().getMethod()).isEqualTo(RegistrationMethod.IDENTITY);
        assertThat(outcome.getRegistration().isDegraded()).isTrue();
        assertThat(outcome.getMetrics().getMadPx()).isCloseTo(0.0, within(1e-9));
        assertThat(outcome.getMetrics().getIpn()).isCloseTo(100.0, within(1e-9));
        assertThat(outcome.getCalibration().isCalibrated()).isFalse();
    }

    @Test
    void run_identicalImages_writesReportAndDistances() throws IOException {
        Path template = writeImage("template.png", SyntheticImages.filledRect(300, 300, 100, 100, 200, 200));
        Path test = writeImage("test.png", SyntheticImages.filledRect(300, 300, 100, 100, 200, 200));
        Path out = tempDir.resolve("out");

        ComparisonRequest request = new ComparisonRequest();
        request.setTemplateImage(template);
        request.setTestImage(test);
        request.setOutputDir(out);
        request.setManualMmPerPx(0.1);

        ComparisonReport report = service.run(request);

        assertThat(report.getStatus()).isEqualTo(ComparisonReport.STATUS_OK);
        assertThat(report.getRunId()).matches("\\d{8}T\\d{6}-[0-9a-f]{8}");
        assertThat(report.getMetrics().getIpn()).isGreaterThan(95.0);
        assertThat(report.getMetrics().getMadMm()).isNotNull();
        assertThat(report.getCalibration().getMethod()).isEqualTo("manual");
        assertThat(report.getCalibration().getStatus()).isEqualTo("manual");
        assertThat(report.getTauCalibration().getMode()).isEqualTo("fixed");
        assertThat(report.getRegistration().getCandidates()).isNotEmpty();
        assertThat(out.resolve(ReportRepository.REPORT_FILE)).exists();
        List<String> distances = Files.readAllLines(out.resolve(ReportRepository.DISTANCES_FILE));
        assertThat(distances.get(0)).isEqualTo(ReportRepository.DISTANCES_HEADER);
        assertThat(distances).hasSize(report.getDiagnostics().getRealPoints() + 1);
    }

    @Test
    void run_blankTemplate_writesFailedReportAndThrows() {
        Path template = writeImage("blank.png", SyntheticImages.blank(300, 300));
        Path test = writeImage("test.png", SyntheticImages.filledRect(300, 300, 100, 100, 200, 200));
        Path out = tempDir.resolve("failed");

        ComparisonRequest request = new ComparisonRequest();
        request.setTemplateImage(template);
        request.setTestImage(test);
        request.setOutputDir(out);

        assertThatThrownBy(() -> service.run(request))
            .isInstanceOfSatisfying(ExtractionFailureException.class, e -> {
                assertThat(e.getStage()).isEqualTo("template");
                assertThat(e.getReason()).isIn("no_contour", "contour_too_small");
            });

        ComparisonReport report = reportRepository.loadReport(out.resolve(ReportRepository.REPORT_FILE));
        assertThat(report.getStatus()).isEqualTo(ComparisonReport.STATUS_FAILED);
        assertThat(report.getMetrics()).isNull();
        assertThat(report.getStages().get("template_extraction").isSuccess()).isFalse();
        assertThat(report.getStages().get("test_extraction").isSuccess()).isTrue();
    }

    @Test
    void run_fixedTauWithAutomaticCalibration_rejected() {
        TauCalibrationRequest tau = new TauCalibrationRequest();
        tau.setReportPatterns(List.of("reports/*.json"));

        ComparisonRequest request = new ComparisonRequest();
        request.setTemplateImage(tempDir.resolve("a.png"));
        request.setTestImage(tempDir.resolve("b.png"));
        request.setOutputDir(tempDir.resolve("out"));
        request.setTau(0.02);
        request.setTauCalibration(tau);

        assertThatThrownBy(() -> service.run(request))
            .isInstanceOf(TauConfigurationException.class);
    }

    private Path writeImage(String name, Mat image) {
        Path file = tempDir.resolve(name);
        Imgcodecs.imwrite(file.toString(), image);
        image.release();
        return file;
    }
}
