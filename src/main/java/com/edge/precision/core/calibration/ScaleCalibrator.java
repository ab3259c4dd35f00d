package com.edge.precision.core.calibration;

import com.edge.precision.config.NativeLibraryLoader;
import com.edge.precision.config.PrecisionConfig;
import com.edge.precision.util.MatConverter;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 标尺比例标定
 * <p>
 * 手动比例优先；否则在理想图上用 Canny + 概率霍夫检测标尺线段，
 * 取水平、垂直两组长度中位数的中位数作为标尺像素长度
 */
public class ScaleCalibrator {
    private static final Logger logger = LoggerFactory.getLogger(ScaleCalibrator.class);

    private static final String METHOD_RULER = "ruler_detection";

    private final PrecisionConfig.CalibrationConfig config;

    public ScaleCalibrator(PrecisionConfig.CalibrationConfig config) {
        NativeLibraryLoader.loadNativeLibraries();
        this.config = config;
    }

    /**
     * @param image          理想图，可为空
     * @param manualOverride 单次运行的手动比例，优先于配置
     */
    public ScaleCalibration calibrate(Mat image, Double manualOverride) {
        Double manual = manualOverride != null ? manualOverride : config.getManualMmPerPx();
        if (manual != null) {
            if (!(manual > 0) || !Double.isFinite(manual)) {
                throw new IllegalArgumentException("manual mm-per-px must be positive, got " + manual);
            }
            logger.info("Scale calibration: manual mm_per_px={}", manual);
            return ScaleCalibration.manual(manual);
        }
        if (image == null || image.empty()) {
            return ScaleCalibration.missing(METHOD_RULER, Map.of("reason", "no_image"));
        }

        Mat gray = null;
        Mat edges = new Mat();
        Mat lines = new Mat();
        try {
            gray = MatConverter.toGray(image);
            Imgproc.Canny(gray, edges, config.getCannyLow(), config.getCannyHigh());
            double minLength = Math.max(gray.rows(), gray.cols()) * config.getRulerMinLineRatio();
            Imgproc.HoughLinesP(edges, lines, 1, Math.PI / 180, config.getHoughThreshold(), minLength, config.getHoughMaxGap());

            List<Double> horizontal = new ArrayList<>();
            List<Double> vertical = new ArrayList<>();
            for (int i = 0; i < lines.rows(); i++) {
                double[] l = lines.get(i, 0);
                double dx = Math.abs(l[2] - l[0]);
                double dy = Math.abs(l[3] - l[1]);
                double length = Math.hypot(dx, dy);
                if (dy <= Math.max(2.0, 0.2 * dx)) {
                    horizontal.add(length);
                } else if (dx <= Math.max(2.0, 0.2 * dy)) {
                    vertical.add(length);
                }
            }

            List<Double> candidates = new ArrayList<>();
            if (!horizontal.isEmpty()) {
                candidates.add(median(horizontal));
            }
            if (!vertical.isEmpty()) {
                candidates.add(median(vertical));
            }

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("horizontal_segments", horizontal.size());
            details.put("vertical_segments", vertical.size());
            if (candidates.isEmpty()) {
                logger.warn("Scale calibration: no ruler segments found, metrics stay in pixels");
                details.put("reason", "no_ruler_lines");
                return ScaleCalibration.missing(METHOD_RULER, details);
            }

            double rulerPx = median(candidates);
            details.put("ruler_px", rulerPx);
            details.put("ruler_mm", config.getRulerMm());
            double mmPerPx = config.getRulerMm() / rulerPx;
            logger.info("Scale calibration: ruler {}px -> mm_per_px={}", rulerPx, mmPerPx);
            return new ScaleCalibration(mmPerPx, ScaleCalibration.Status.RESOLVED, METHOD_RULER, details);
        } finally {
            if (gray != null) gray.release();
            edges.release();
            lines.release();
        }
    }

    static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int n = sorted.size();
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }
}
