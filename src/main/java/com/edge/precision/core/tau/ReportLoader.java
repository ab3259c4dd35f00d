package com.edge.precision.core.tau;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 读取历史 report.json 的 metrics 块
 * <p>
 * 无法解析或缺少有效 mad/scale 的报告被跳过并记录警告
 */
public class ReportLoader {
    private static final Logger logger = LoggerFactory.getLogger(ReportLoader.class);

    private final ObjectMapper objectMapper;

    public ReportLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<TauReport> loadAll(List<Path> paths) {
        List<TauReport> reports = new ArrayList<>();
        for (Path path : paths) {
            load(path).ifPresent(reports::add);
        }
        return reports;
    }

    public Optional<TauReport> load(Path path) {
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            logger.warn("Skipping unreadable report {}: {}", path, e.getMessage());
            return Optional.empty();
        }
        JsonNode metrics = root == null ? null : root.get("metrics");
        if (metrics == null || !metrics.isObject()) {
            logger.warn("Skipping report without metrics block: {}", path);
            return Optional.empty();
        }
        TauReport report = new TauReport(path,
            number(metrics, "mad_px"), number(metrics, "scale_px"),
            number(metrics, "mad_mm"), number(metrics, "scale_mm"));
        if (!report.supports(TauUnits.PX) && !report.supports(TauUnits.MM)) {
            logger.warn("Skipping report with invalid metrics: {}", path);
            return Optional.empty();
        }
        return Optional.of(report);
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }
}
