package com.edge.precision.core.tau;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * 将 glob 模式展开为去重、排序后的报告文件列表
 */
public class ReportPathCollector {
    private static final Logger logger = LoggerFactory.getLogger(ReportPathCollector.class);

    private final Path baseDir;

    public ReportPathCollector() {
        this(Paths.get("").toAbsolutePath());
    }

    public ReportPathCollector(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    public List<Path> collect(List<String> patterns) {
        TreeSet<Path> paths = new TreeSet<>();
        if (patterns == null) {
            return new ArrayList<>();
        }
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            List<Path> matched = expand(pattern.trim());
            if (matched.isEmpty()) {
                logger.warn("Report pattern matched no files: {}", pattern);
            }
            paths.addAll(matched);
        }
        return new ArrayList<>(paths);
    }

    private List<Path> expand(String pattern) {
        String normalized = pattern.replace('\\', '/');
        if (!hasGlob(normalized)) {
            Path file = resolve(normalized);
            return Files.isRegularFile(file) ? List.of(file) : List.of();
        }

        // 最长的无通配符前缀作为遍历起点
        String[] parts = normalized.split("/");
        StringBuilder prefix = new StringBuilder(normalized.startsWith("/") ? "/" : "");
        for (String part : parts) {
            if (part.isEmpty()) {
                continue;
            }
            if (hasGlob(part)) {
                break;
            }
            prefix.append(part).append('/');
        }
        Path root = resolve(prefix.length() == 0 ? "." : prefix.toString());
        if (!Files.isDirectory(root)) {
            return List.of();
        }

        String absolutePattern = Paths.get(normalized).isAbsolute()
            ? normalized
            : baseDir.toString().replace('\\', '/') + "/" + normalized;
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + absolutePattern);

        List<Path> result = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(root)) {
            stream.filter(Files::isRegularFile)
                .map(p -> p.toAbsolutePath().normalize())
                .filter(matcher::matches)
                .forEach(result::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan reports under " + root, e);
        }
        return result;
    }

    private Path resolve(String path) {
        Path p = Paths.get(path);
        return (p.isAbsolute() ? p : baseDir.resolve(p)).toAbsolutePath().normalize();
    }

    private static boolean hasGlob(String s) {
        return s.indexOf('*') >= 0 || s.indexOf('?') >= 0 || s.indexOf('[') >= 0 || s.indexOf('{') >= 0;
    }
}
