package com.edge.precision.core.resample;

import com.edge.precision.core.model.ContourPoints;
import com.edge.precision.core.model.Point;
import com.edge.precision.core.model.ResampledContour;
import com.edge.precision.exception.DegenerateContourException;

import java.util.ArrayList;
import java.util.List;

/**
 * 轮廓重采样器
 * <p>
 * 沿闭合多边形按弧长等间距取点，采样位置为 k * L / n (k = 0..n-1)，
 * 在所在线段上线性插值
 */
public class ContourResampler {
    private static final double EPS = 1e-9;

    public ResampledContour resample(ContourPoints contour, SamplingPolicy policy) {
        List<Point> vertices = dropConsecutiveDuplicates(contour.getPoints());
        if (countDistinct(vertices) < 3) {
            throw new DegenerateContourException(
                "Contour needs at least 3 distinct points, got " + countDistinct(vertices));
        }

        int m = vertices.size();
        // cumulative[i] = 从首点到第 i 个顶点的弧长，cumulative[m] = 周长
        double[] cumulative = new double[m + 1];
        for (int i = 0; i < m; i++) {
            cumulative[i + 1] = cumulative[i] + vertices.get(i).distanceTo(vertices.get((i + 1) % m));
        }
        double perimeter = cumulative[m];
        if (perimeter <= EPS) {
            throw new DegenerateContourException("Contour perimeter is zero");
        }

        int n = policy.pointCount(perimeter);
        List<Point> sampled = new ArrayList<>(n);
        int segment = 0;
        for (int k = 0; k < n; k++) {
            double target = perimeter * k / n;
            while (segment < m - 1 && cumulative[segment + 1] <= target) {
                segment++;
            }
            double segLength = cumulative[segment + 1] - cumulative[segment];
            double t = segLength > EPS ? (target - cumulative[segment]) / segLength : 0.0;
            Point a = vertices.get(segment);
            Point b = vertices.get((segment + 1) % m);
            sampled.add(new Point(a.x + t * (b.x - a.x), a.y + t * (b.y - a.y)));
        }
        return new ResampledContour(sampled, perimeter, perimeter / n);
    }

    /**
     * 去掉相邻重复点以及与首点重合的末点（显式闭合）
     */
    private static List<Point> dropConsecutiveDuplicates(List<Point> points) {
        List<Point> result = new ArrayList<>(points.size());
        for (Point p : points) {
            if (result.isEmpty() || !samePosition(result.get(result.size() - 1), p)) {
                result.add(p);
            }
        }
        while (result.size() > 1 && samePosition(result.get(0), result.get(result.size() - 1))) {
            result.remove(result.size() - 1);
        }
        return result;
    }

    private static int countDistinct(List<Point> points) {
        List<Point> distinct = new ArrayList<>();
        for (Point p : points) {
            boolean seen = false;
            for (Point q : distinct) {
                if (samePosition(p, q)) {
                    seen = true;
                    break;
                }
            }
            if (!seen) {
                distinct.add(p);
                if (distinct.size() >= 3) {
                    return distinct.size();
                }
            }
        }
        return distinct.size();
    }

    private static boolean samePosition(Point a, Point b) {
        return Math.abs(a.x - b.x) <= EPS && Math.abs(a.y - b.y) <= EPS;
    }
}
