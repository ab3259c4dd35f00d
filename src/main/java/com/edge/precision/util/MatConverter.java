package com.edge.precision.util;

import com.edge.precision.core.model.ContourPoints;
import com.edge.precision.core.model.Point;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * 轮廓点与 OpenCV Mat 之间的转换
 */
public final class MatConverter {

    private MatConverter() {
    }

    /**
     * 四舍五入到整数像素，用于绘制
     */
    public static MatOfPoint toRoundedMatOfPoint(List<Point> points) {
        org.opencv.core.Point[] cvPoints = new org.opencv.core.Point[points.size()];
        for (int i = 0; i < cvPoints.length; i++) {
            Point p = points.get(i);
            cvPoints[i] = new org.opencv.core.Point(Math.round(p.x), Math.round(p.y));
        }
        return new MatOfPoint(cvPoints);
    }

    public static ContourPoints toContour(MatOfPoint mat) {
        List<Point> points = new ArrayList<>();
        for (org.opencv.core.Point p : mat.toArray()) {
            points.add(new Point(p.x, p.y));
        }
        return new ContourPoints(points);
    }

    /**
     * 转灰度图，单通道时返回副本
     */
    public static Mat toGray(Mat image) {
        Mat gray = new Mat();
        if (image.channels() == 3) {
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
        } else if (image.channels() == 4) {
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGRA2GRAY);
        } else {
            image.copyTo(gray);
        }
        return gray;
    }

    /**
     * 读取 CV_32F 单通道 Mat 为数组
     */
    public static float[] toFloatArray(Mat mat) {
        Mat source = mat;
        if (mat.type() != CvType.CV_32FC1) {
            source = new Mat();
            mat.convertTo(source, CvType.CV_32F);
        }
        float[] data = new float[(int) source.total()];
        if (source.isContinuous()) {
            source.get(0, 0, data);
        } else {
            int cols = source.cols();
            float[] row = new float[cols];
            for (int r = 0; r < source.rows(); r++) {
                source.get(r, 0, row);
                System.arraycopy(row, 0, data, r * cols, cols);
            }
        }
        if (source != mat) {
            source.release();
        }
        return data;
    }
}
