package com.edge.precision.repository;

import com.edge.precision.core.metrics.PointDistance;
import com.edge.precision.dto.ComparisonReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * 报告产物持久化：report.json 与 distances.csv
 */
@Repository
public class ReportRepository {
    private static final Logger logger = LoggerFactory.getLogger(ReportRepository.class);

    public static final String REPORT_FILE = "report.json";
    public static final String DISTANCES_FILE = "distances.csv";
    public static final String DISTANCES_HEADER = "idx,x,y,d_px,d_mm";

    private final ObjectMapper objectMapper;

    @Autowired
    public ReportRepository(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Path saveReport(Path outputDir, ComparisonReport report) {
        Path file = outputDir.resolve(REPORT_FILE);
        try {
            Files.createDirectories(outputDir);
            objectMapper.writeValue(file.toFile(), report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report " + file, e);
        }
        logger.info("Report written: {}", file);
        return file;
    }

    public Path saveDistances(Path outputDir, List<PointDistance> distances) {
        Path file = outputDir.resolve(DISTANCES_FILE);
        try {
            Files.createDirectories(outputDir);
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                writer.write(DISTANCES_HEADER);
                writer.newLine();
                for (PointDistance d : distances) {
                    writer.write(String.format(Locale.ROOT, "%d,%.4f,%.4f,%.6f,%s",
                        d.getIndex(), d.getX(), d.getY(), d.getDistancePx(),
                        d.getDistanceMm() == null ? "" : String.format(Locale.ROOT, "%.6f", d.getDistanceMm())));
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write distances " + file, e);
        }
        logger.info("Distances written: {} ({} points)", file, distances.size());
        return file;
    }

    public ComparisonReport loadReport(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), ComparisonReport.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read report " + file, e);
        }
    }
}
