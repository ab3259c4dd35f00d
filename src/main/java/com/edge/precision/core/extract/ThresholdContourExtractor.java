package com.edge.precision.core.extract;

import com.edge.precision.config.NativeLibraryLoader;
import com.edge.precision.config.PrecisionConfig;
import com.edge.precision.util.MatConverter;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 阈值轮廓提取：灰度 -> 高斯模糊 -> Otsu -> 闭运算 -> 面积最大的外轮廓
 */
public class ThresholdContourExtractor implements ContourExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ThresholdContourExtractor.class);

    private final PrecisionConfig.ExtractionConfig config;

    public ThresholdContourExtractor(PrecisionConfig.ExtractionConfig config) {
        NativeLibraryLoader.loadNativeLibraries();
        this.config = config;
    }

    @Override
    public ExtractionResult extract(Mat image) {
        if (image == null || image.empty()) {
            return ExtractionResult.failure("empty_image");
        }
        Mat gray = null;
        Mat blurred = new Mat();
        Mat binary = new Mat();
        Mat kernel = null;
        Mat hierarchy = new Mat();
        List<MatOfPoint> contours = new ArrayList<>();
        try {
            gray = MatConverter.toGray(image);
            int blur = oddKernel(config.getBlurKernel());
            if (blur > 1) {
                Imgproc.GaussianBlur(gray, blurred, new Size(blur, blur), 0);
            } else {
                gray.copyTo(blurred);
            }

            int type = (config.isInvert() ? Imgproc.THRESH_BINARY_INV : Imgproc.THRESH_BINARY) + Imgproc.THRESH_OTSU;
            Imgproc.threshold(blurred, binary, 0, 255, type);

            int close = oddKernel(config.getCloseKernel());
            if (close > 1) {
                kernel = Imgproc.getStructuringElement(Imgproc.MORPH_ELLIPSE, new Size(close, close));
                Imgproc.morphologyEx(binary, binary, Imgproc.MORPH_CLOSE, kernel);
            }

            Imgproc.findContours(binary, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_NONE);
            if (contours.isEmpty()) {
                return ExtractionResult.failure("no_contour");
            }

            MatOfPoint largest = null;
            double largestArea = -1.0;
            for (MatOfPoint c : contours) {
                double area = Imgproc.contourArea(c);
                if (area > largestArea) {
                    largestArea = area;
                    largest = c;
                }
            }
            double minArea = config.getMinAreaRatio() * image.rows() * image.cols();
            if (largest == null || largestArea < minArea || largest.rows() < 3) {
                logger.debug("Largest contour area {} below minimum {}", largestArea, minArea);
                return ExtractionResult.failure("contour_too_small");
            }
            logger.debug("Extracted contour: {} points, area={}", largest.rows(), largestArea);
            return ExtractionResult.success(MatConverter.toContour(largest), largestArea);
        } finally {
            if (gray != null) gray.release();
            blurred.release();
            binary.release();
            if (kernel != null) kernel.release();
            hierarchy.release();
            for (MatOfPoint c : contours) {
                c.release();
            }
        }
    }

    private static int oddKernel(int size) {
        if (size <= 1) {
            return 1;
        }
        return size % 2 == 0 ? size + 1 : size;
    }
}
