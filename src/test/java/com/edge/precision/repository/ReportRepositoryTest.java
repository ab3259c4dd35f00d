package com.edge.precision.repository;

import com.edge.precision.core.metrics.PointDistance;
import com.edge.precision.dto.ComparisonReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReportRepositoryTest {
    private final ReportRepository repository = new ReportRepository(new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));

    @TempDir
    Path tempDir;

    @Test
    void saveReport_thenLoad_keepsMetricsAndRegistration() {
        ComparisonReport report = new ComparisonReport();
        report.setStatus(ComparisonReport.STATUS_OK);
        report.setRunId("20240101T000000-abcdef12");
        report.setTimestampUtc(Instant.parse("2024-01-01T00:00:00Z"));
        ComparisonReport.MetricsBlock metrics = new ComparisonReport.MetricsBlock();
        metrics.setMadPx(1.25);
        metrics.setScalePx(400.0);
        metrics.setIpn(84.375);
        report.setMetrics(metrics);
        ComparisonReport.RegistrationBlock registration = new ComparisonReport.RegistrationBlock();
        registration.setMethod("identity");
        registration.setTransform(new double[][]{{1, 0, 0}, {0, 1, 0}, {0, 0, 1}});
        report.setRegistration(registration);

        Path file = repository.saveReport(tempDir.resolve("run"), report);
        ComparisonReport loaded = repository.loadReport(file);

        assertThat(file.getFileName().toString()).isEqualTo(ReportRepository.REPORT_FILE);
        assertThat(loaded.getRunId()).isEqualTo(report.getRunId());
        assertThat(loaded.getTimestampUtc()).isEqualTo(report.getTimestampUtc());
        assertThat(loaded.getMetrics().getMadPx()).isEqualTo(1.25);
        assertThat(loaded.getMetrics().getMadMm()).isNull();
        assertThat(loaded.getRegistration().getTransform()[1][1]).isEqualTo(1.0);
    }

    @Test
    void saveReport_writesSnakeCaseFields() throws IOException {
        ComparisonReport report = new ComparisonReport();
        report.setStatus(ComparisonReport.STATUS_OK);
        ComparisonReport.MetricsBlock metrics = new ComparisonReport.MetricsBlock();
        metrics.setMadPx(2.0);
        report.setMetrics(metrics);

        String json = Files.readString(repository.saveReport(tempDir, report));

        assertThat(json).contains("\"mad_px\"").contains("\"scale_px\"").doesNotContain("\"mad_mm\"");
    }

    @Test
    void saveDistances_writesHeaderAndBlankMillimetersWhenUncalibrated() throws IOException {
        List<PointDistance> distances = List.of(
            new PointDistance(0, 10.0, 20.0, 0.5, 0.05),
            new PointDistance(1, 11.5, 20.0, 1.0, null));

        Path file = repository.saveDistances(tempDir, distances);

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).containsExactly(
            ReportRepository.DISTANCES_HEADER,
            "0,10.0000,20.0000,0.500000,0.050000",
            "1,11.5000,20.0000,1.000000,");
    }
}
