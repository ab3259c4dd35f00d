package com.edge.precision.core.distance;

import com.edge.precision.core.model.ContourPoints;
import com.edge.precision.core.model.Point;
import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.NearestNeighborSearchOnKDTree;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 KD 树的最近邻距离
 * <p>
 * 计算查询点到索引点集的真实最小欧氏距离，用于交叉验证距离场和双向诊断
 */
public class NearestNeighborValidator {

    /**
     * 每个查询点到参考轮廓的最近距离；任一为空时返回空数组
     */
    public double[] nearestDistances(ContourPoints queries, ContourPoints reference) {
        if (queries.isEmpty() || reference.isEmpty()) {
            return new double[0];
        }
        // KDTree 会对列表重排，值和位置使用同一列表
        List<RealPoint> indexed = new ArrayList<>(reference.size());
        for (Point p : reference.getPoints()) {
            indexed.add(new RealPoint(p.x, p.y));
        }
        NearestNeighborSearchOnKDTree<RealPoint> search =
            new NearestNeighborSearchOnKDTree<>(new KDTree<>(indexed, indexed));

        double[] distances = new double[queries.size()];
        RealPoint query = new RealPoint(2);
        for (int i = 0; i < distances.length; i++) {
            Point p = queries.get(i);
            query.setPosition(p.x, 0);
            query.setPosition(p.y, 1);
            search.search(query);
            distances[i] = search.getDistance();
        }
        return distances;
    }

    /**
     * 将距离场结果与 KD 树结果比对
     *
     * @param fieldDistances 距离场逐点采样值（与 queries 一一对应）
     * @param tolerancePx    两种 MAD 允许的最大差值
     */
    public DistanceValidation validate(double[] fieldDistances, ContourPoints queries,
                                       ContourPoints reference, double tolerancePx) {
        if (queries.isEmpty() || reference.isEmpty() || fieldDistances.length != queries.size()) {
            return DistanceValidation.invalidInputs();
        }
        double[] nnDistances = nearestDistances(queries, reference);
        double fieldMad = 0.0;
        double nnMad = 0.0;
        double absDelta = 0.0;
        for (int i = 0; i < nnDistances.length; i++) {
            fieldMad += fieldDistances[i];
            nnMad += nnDistances[i];
            absDelta += Math.abs(fieldDistances[i] - nnDistances[i]);
        }
        int n = nnDistances.length;
        fieldMad /= n;
        nnMad /= n;
        absDelta /= n;

        double madDelta = Math.abs(fieldMad - nnMad);
        ValidationStatus status = madDelta <= tolerancePx ? ValidationStatus.OK : ValidationStatus.MISMATCH;
        return new DistanceValidation(status, fieldMad, nnMad, madDelta, absDelta, tolerancePx);
    }
}
