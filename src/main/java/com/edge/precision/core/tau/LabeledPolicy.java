package com.edge.precision.core.tau;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 标注模式策略：目标函数与可选约束（为 null 表示不约束）
 */
public final class LabeledPolicy {
    private final String name;
    private final TauObjective objective;
    private final Double maxMeanIpnBad;
    private final Double minMeanIpnGap;
    private final Double minTpr;
    private final Double minTnr;

    public LabeledPolicy(String name, TauObjective objective, Double maxMeanIpnBad, Double minMeanIpnGap,
                         Double minTpr, Double minTnr) {
        this.name = name;
        this.objective = objective;
        this.maxMeanIpnBad = maxMeanIpnBad;
        this.minMeanIpnGap = minMeanIpnGap;
        this.minTpr = minTpr;
        this.minTnr = minTnr;
    }

    /**
     * 逐项覆盖，参数为 null 时保留原值
     */
    public LabeledPolicy withOverrides(TauObjective objective, Double maxMeanIpnBad, Double minMeanIpnGap,
                                       Double minTpr, Double minTnr) {
        return new LabeledPolicy(name,
            objective != null ? objective : this.objective,
            maxMeanIpnBad != null ? maxMeanIpnBad : this.maxMeanIpnBad,
            minMeanIpnGap != null ? minMeanIpnGap : this.minMeanIpnGap,
            minTpr != null ? minTpr : this.minTpr,
            minTnr != null ? minTnr : this.minTnr);
    }

    public boolean isSatisfiedBy(TauCurvePoint point) {
        return violations(point).isEmpty();
    }

    /**
     * 列出不满足的约束名
     */
    public List<String> violations(TauCurvePoint point) {
        List<String> violated = new ArrayList<>();
        if (maxMeanIpnBad != null && point.getMeanIpnBad() > maxMeanIpnBad) {
            violated.add("max_mean_ipn_bad");
        }
        if (minMeanIpnGap != null && point.getMeanIpnGap() < minMeanIpnGap) {
            violated.add("min_mean_ipn_gap");
        }
        if (minTpr != null && point.getTpr() < minTpr) {
            violated.add("min_tpr");
        }
        if (minTnr != null && point.getTnr() < minTnr) {
            violated.add("min_tnr");
        }
        return violated;
    }

    public Map<String, Double> constraints() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("max_mean_ipn_bad", maxMeanIpnBad);
        map.put("min_mean_ipn_gap", minMeanIpnGap);
        map.put("min_tpr", minTpr);
        map.put("min_tnr", minTnr);
        return map;
    }

    public String getName() { return name; }

    public TauObjective getObjective() { return objective; }

    public Double getMaxMeanIpnBad() { return maxMeanIpnBad; }

    public Double getMinMeanIpnGap() { return minMeanIpnGap; }

    public Double getMinTpr() { return minTpr; }

    public Double getMinTnr() { return minTnr; }

    @Override
    public String toString() {
        return String.format("LabeledPolicy[%s, objective=%s, constraints=%s]", name, objective.getCode(), constraints());
    }
}
