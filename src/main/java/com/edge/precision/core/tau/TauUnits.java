package com.edge.precision.core.tau;

import java.util.List;

/**
 * 报告指标单位
 */
public enum TauUnits {
    PX("px"),
    MM("mm");

    private final String code;

    TauUnits(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 选择单位：优先单位被所有报告支持时使用之，否则取另一个被全部支持的单位；
     * 都不满足时取优先顺序中至少一个报告支持的单位，缺失该单位的报告随后被过滤
     *
     * @return 无任何报告可用时返回 null
     */
    public static TauUnits choose(List<TauReport> reports, boolean preferMm) {
        TauUnits[] order = preferMm ? new TauUnits[]{MM, PX} : new TauUnits[]{PX, MM};
        for (TauUnits units : order) {
            if (!reports.isEmpty() && reports.stream().allMatch(r -> r.supports(units))) {
                return units;
            }
        }
        for (TauUnits units : order) {
            if (reports.stream().anyMatch(r -> r.supports(units))) {
                return units;
            }
        }
        return null;
    }
}
