package com.edge.precision.core.registration;

import com.edge.precision.core.model.ContourPoints;
import com.edge.precision.core.model.Point;
import org.opencv.core.Mat;

import java.util.Arrays;

/**
 * 3x3 投影变换（行主序），把实测坐标映射到理想坐标系
 * <p>
 * 仿射与平移变换以最后一行 [0, 0, 1] 表示
 */
public final class HomographyTransform {
    private static final HomographyTransform IDENTITY = new HomographyTransform(new double[]{
        1, 0, 0,
        0, 1, 0,
        0, 0, 1
    });

    private final double[] m;

    public HomographyTransform(double[] m) {
        if (m.length != 9) {
            throw new IllegalArgumentException("Homography needs 9 values, got " + m.length);
        }
        this.m = Arrays.copyOf(m, 9);
    }

    public static HomographyTransform identity() {
        return IDENTITY;
    }

    public static HomographyTransform translation(double tx, double ty) {
        return new HomographyTransform(new double[]{1, 0, tx, 0, 1, ty, 0, 0, 1});
    }

    public static HomographyTransform scale(double sx, double sy) {
        return new HomographyTransform(new double[]{sx, 0, 0, 0, sy, 0, 0, 0, 1});
    }

    /**
     * 由 2x3 仿射或 3x3 投影 Mat 构建
     */
    public static HomographyTransform fromMat(Mat mat) {
        if ((mat.rows() != 2 && mat.rows() != 3) || mat.cols() != 3) {
            throw new IllegalArgumentException("Expected 2x3 or 3x3 matrix, got " + mat.rows() + "x" + mat.cols());
        }
        double[] values = {0, 0, 0, 0, 0, 0, 0, 0, 1};
        for (int r = 0; r < mat.rows(); r++) {
            for (int c = 0; c < 3; c++) {
                values[r * 3 + c] = mat.get(r, c)[0];
            }
        }
        return new HomographyTransform(values);
    }

    public double get(int row, int col) {
        return m[row * 3 + col];
    }

    public double[] toArray() {
        return Arrays.copyOf(m, 9);
    }

    /**
     * 二维数组形式，便于 JSON 输出
     */
    public double[][] toRows() {
        return new double[][]{
            {m[0], m[1], m[2]},
            {m[3], m[4], m[5]},
            {m[6], m[7], m[8]}
        };
    }

    public Point apply(Point p) {
        double w = m[6] * p.x + m[7] * p.y + m[8];
        if (Math.abs(w) < 1e-12) {
            w = 1e-12;
        }
        double x = (m[0] * p.x + m[1] * p.y + m[2]) / w;
        double y = (m[3] * p.x + m[4] * p.y + m[5]) / w;
        return new Point(x, y);
    }

    public ContourPoints apply(ContourPoints contour) {
        return contour.map(this::apply);
    }

    /**
     * 矩阵乘积 this * other（先应用 other，再应用 this）
     */
    public HomographyTransform multiply(HomographyTransform other) {
        double[] r = new double[9];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                double sum = 0.0;
                for (int k = 0; k < 3; k++) {
                    sum += m[i * 3 + k] * other.m[k * 3 + j];
                }
                r[i * 3 + j] = sum;
            }
        }
        return new HomographyTransform(r);
    }

    public double determinant() {
        return m[0] * (m[4] * m[8] - m[5] * m[7])
            - m[1] * (m[3] * m[8] - m[5] * m[6])
            + m[2] * (m[3] * m[7] - m[4] * m[6]);
    }

    public HomographyTransform inverse() {
        double det = determinant();
        if (Math.abs(det) < 1e-12) {
            throw new IllegalStateException("Transform is singular");
        }
        double[] inv = {
            (m[4] * m[8] - m[5] * m[7]) / det,
            (m[2] * m[7] - m[1] * m[8]) / det,
            (m[1] * m[5] - m[2] * m[4]) / det,
            (m[5] * m[6] - m[3] * m[8]) / det,
            (m[0] * m[8] - m[2] * m[6]) / det,
            (m[2] * m[3] - m[0] * m[5]) / det,
            (m[3] * m[7] - m[4] * m[6]) / det,
            (m[1] * m[6] - m[0] * m[7]) / det,
            (m[0] * m[4] - m[1] * m[3]) / det
        };
        return new HomographyTransform(inv);
    }

    public boolean isFinite() {
        for (double v : m) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("[[%.4f, %.4f, %.2f], [%.4f, %.4f, %.2f], [%.6f, %.6f, %.4f]]",
            m[0], m[1], m[2], m[3], m[4], m[5], m[6], m[7], m[8]);
    }
}
