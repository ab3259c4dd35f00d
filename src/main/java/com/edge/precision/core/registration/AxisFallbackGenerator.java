package com.edge.precision.core.registration;

import com.edge.precision.config.NativeLibraryLoader;
import com.edge.precision.config.PrecisionConfig;
import com.edge.precision.core.model.Point;
import com.edge.precision.util.MatConverter;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 坐标轴兜底配准
 * <p>
 * 在两幅图中检测近水平（下方区域）与近垂直（左侧区域）的基准线，
 * 由原点和两轴方向、跨度构成坐标框架，求实测框架到理想框架的仿射映射
 */
public class AxisFallbackGenerator implements RegistrationGenerator {
    private static final Logger logger = LoggerFactory.getLogger(AxisFallbackGenerator.class);

    private final PrecisionConfig.RegistrationConfig config;

    public AxisFallbackGenerator(PrecisionConfig.RegistrationConfig config) {
        NativeLibraryLoader.loadNativeLibraries();
        this.config = config;
    }

    @Override
    public RegistrationMethod getMethod() {
        return RegistrationMethod.AXIS_FALLBACK;
    }

    @Override
    public RegistrationCandidate produceCandidate(RegistrationInput input) {
        if (!input.hasImages()) {
            return RegistrationCandidate.failure(getMethod(), "missing_images");
        }
        try {
            AxisFrame real = detectFrame(input.getRealImage());
            AxisFrame ideal = detectFrame(input.getIdealImage());
            if (real == null || ideal == null) {
                return RegistrationCandidate.failure(getMethod(), "axis_detection_failed");
            }

            // 基矩阵列向量为 u * span
            double[] src = {
                real.horizontal[0] * real.spanH, real.vertical[0] * real.spanV,
                real.horizontal[1] * real.spanH, real.vertical[1] * real.spanV
            };
            double[] dst = {
                ideal.horizontal[0] * ideal.spanH, ideal.vertical[0] * ideal.spanV,
                ideal.horizontal[1] * ideal.spanH, ideal.vertical[1] * ideal.spanV
            };
            double det = src[0] * src[3] - src[1] * src[2];
            if (Math.abs(det) < 1e-9) {
                return RegistrationCandidate.failure(getMethod(), "axis_singular_basis");
            }
            double[] srcInv = {src[3] / det, -src[1] / det, -src[2] / det, src[0] / det};
            double a = dst[0] * srcInv[0] + dst[1] * srcInv[2];
            double b = dst[0] * srcInv[1] + dst[1] * srcInv[3];
            double c = dst[2] * srcInv[0] + dst[3] * srcInv[2];
            double d = dst[2] * srcInv[1] + dst[3] * srcInv[3];
            double tx = ideal.origin.x - (a * real.origin.x + b * real.origin.y);
            double ty = ideal.origin.y - (c * real.origin.x + d * real.origin.y);

            HomographyTransform transform = new HomographyTransform(new double[]{a, b, tx, c, d, ty, 0, 0, 1});
            logger.debug("Axis registration: realOrigin={}, idealOrigin={}", real.origin, ideal.origin);
            return RegistrationCandidate.success(getMethod(), transform)
                .withMatches(real.segmentCount + ideal.segmentCount, 4);
        } catch (Exception e) {
            logger.warn("Axis registration failed: {}", e.getMessage());
            return RegistrationCandidate.failure(getMethod(), "axis_detection_failed");
        }
    }

    /**
     * 检测坐标框架，失败返回 null
     */
    AxisFrame detectFrame(Mat image) {
        Mat gray = null;
        Mat blurred = new Mat();
        Mat edges = new Mat();
        Mat lines = new Mat();
        try {
            gray = MatConverter.toGray(image);
            int width = gray.cols();
            int height = gray.rows();

            Imgproc.GaussianBlur(gray, blurred, new Size(5, 5), 0);
            Imgproc.Canny(blurred, edges, config.getAxesCannyLow(), config.getAxesCannyHigh());

            int threshold = Math.max(30, (int) Math.round(0.5 * config.getAxesHoughThreshold()));
            double minLength = config.getAxesSegmentMinLineRatio() * Math.max(width, height);
            Imgproc.HoughLinesP(edges, lines, 1, Math.PI / 180, threshold, minLength, config.getAxesMaxLineGap());
            if (lines.empty()) {
                return null;
            }

            // 按角度分类线段
            double tol = config.getAxesAngleToleranceDeg();
            List<double[]> horizontal = new ArrayList<>();
            List<double[]> vertical = new ArrayList<>();
            for (int i = 0; i < lines.rows(); i++) {
                double[] l = lines.get(i, 0);
                double angle = Math.toDegrees(Math.atan2(l[3] - l[1], l[2] - l[0]));
                angle = ((angle % 180.0) + 180.0) % 180.0;
                if (Math.min(angle, 180.0 - angle) <= tol) {
                    horizontal.add(l);
                } else if (Math.abs(angle - 90.0) <= tol) {
                    vertical.add(l);
                }
            }

            // 区域筛选，筛空时保留全部
            double minY = config.getAxesHorizontalRoiMinYRatio() * height;
            double maxX = config.getAxesVerticalRoiMaxXRatio() * width;
            List<double[]> horizontalRoi = new ArrayList<>();
            for (double[] l : horizontal) {
                if ((l[1] + l[3]) / 2.0 >= minY) {
                    horizontalRoi.add(l);
                }
            }
            List<double[]> verticalRoi = new ArrayList<>();
            for (double[] l : vertical) {
                if ((l[0] + l[2]) / 2.0 <= maxX) {
                    verticalRoi.add(l);
                }
            }
            if (!horizontalRoi.isEmpty()) {
                horizontal = horizontalRoi;
            }
            if (!verticalRoi.isEmpty()) {
                vertical = verticalRoi;
            }
            if (horizontal.isEmpty() || vertical.isEmpty()) {
                return null;
            }

            double[] lineH = fitLine(horizontal);
            double[] lineV = fitLine(vertical);
            Point origin = intersect(lineH, lineV);
            if (origin == null) {
                return null;
            }

            // 方向约定：水平轴指向 +x，垂直轴指向 -y（图像向上）
            double[] uH = {lineH[0], lineH[1]};
            if (uH[0] < 0) {
                uH[0] = -uH[0];
                uH[1] = -uH[1];
            }
            double[] uV = {lineV[0], lineV[1]};
            if (uV[1] > 0) {
                uV[0] = -uV[0];
                uV[1] = -uV[1];
            }
            double dot = Math.abs(uH[0] * uV[0] + uH[1] * uV[1]);
            if (dot > Math.cos(Math.toRadians(90.0 - tol))) {
                return null;
            }

            double spanH = span(horizontal, origin, uH);
            double spanV = span(vertical, origin, uV);
            if (spanH <= 1.0 || spanV <= 1.0) {
                return null;
            }
            return new AxisFrame(origin, uH, uV, spanH, spanV, horizontal.size() + vertical.size());
        } finally {
            if (gray != null) gray.release();
            blurred.release();
            edges.release();
            lines.release();
        }
    }

    /**
     * 对线段端点做最小二乘直线拟合，返回 (vx, vy, x0, y0)
     */
    private static double[] fitLine(List<double[]> segments) {
        List<org.opencv.core.Point> pts = new ArrayList<>();
        for (double[] l : segments) {
            pts.add(new org.opencv.core.Point(l[0], l[1]));
            pts.add(new org.opencv.core.Point(l[2], l[3]));
        }
        MatOfPoint2f points = new MatOfPoint2f();
        points.fromList(pts);
        Mat line = new Mat(4, 1, CvType.CV_32F);
        try {
            Imgproc.fitLine(points, line, Imgproc.DIST_L2, 0, 0.01, 0.01);
            return new double[]{line.get(0, 0)[0], line.get(1, 0)[0], line.get(2, 0)[0], line.get(3, 0)[0]};
        } finally {
            points.release();
            line.release();
        }
    }

    private static Point intersect(double[] l1, double[] l2) {
        // p1 + t*d1 = p2 + s*d2
        double det = l1[0] * (-l2[1]) - (-l2[0]) * l1[1];
        if (Math.abs(det) < 1e-9) {
            return null;
        }
        double rx = l2[2] - l1[2];
        double ry = l2[3] - l1[3];
        double t = (rx * (-l2[1]) - (-l2[0]) * ry) / det;
        return new Point(l1[2] + t * l1[0], l1[3] + t * l1[1]);
    }

    /**
     * 端点在轴方向上投影绝对值的 95 分位
     */
    private static double span(List<double[]> segments, Point origin, double[] u) {
        double[] projections = new double[segments.size() * 2];
        int k = 0;
        for (double[] l : segments) {
            projections[k++] = Math.abs((l[0] - origin.x) * u[0] + (l[1] - origin.y) * u[1]);
            projections[k++] = Math.abs((l[2] - origin.x) * u[0] + (l[3] - origin.y) * u[1]);
        }
        Arrays.sort(projections);
        double pos = 0.95 * (projections.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, projections.length - 1);
        return projections[lo] + (pos - lo) * (projections[hi] - projections[lo]);
    }

    /**
     * 坐标框架：原点、两轴单位方向与跨度
     */
    static final class AxisFrame {
        final Point origin;
        final double[] horizontal;
        final double[] vertical;
        final double spanH;
        final double spanV;
        final int segmentCount;

        AxisFrame(Point origin, double[] horizontal, double[] vertical, double spanH, double spanV, int segmentCount) {
            this.origin = origin;
            this.horizontal = horizontal;
            this.vertical = vertical;
            this.spanH = spanH;
            this.spanV = spanV;
            this.segmentCount = segmentCount;
        }
    }
}
