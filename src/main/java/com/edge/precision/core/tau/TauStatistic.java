package com.edge.precision.core.tau;

import com.edge.precision.core.metrics.DistanceStatistics;
import com.edge.precision.exception.TauConfigurationException;

import java.util.Locale;

/**
 * 目标模式下对逐报告 IPN 的汇总统计
 */
public enum TauStatistic {
    MEAN("mean") {
        @Override
        public double apply(double[] values) {
            return DistanceStatistics.mean(values);
        }
    },
    MEDIAN("median") {
        @Override
        public double apply(double[] values) {
            return DistanceStatistics.percentile(values, 50.0);
        }
    },
    P75("p75") {
        @Override
        public double apply(double[] values) {
            return DistanceStatistics.percentile(values, 75.0);
        }
    };

    private final String code;

    TauStatistic(String code) {
        this.code = code;
    }

    public abstract double apply(double[] values);

    public String getCode() {
        return code;
    }

    public static TauStatistic fromName(String name) {
        for (TauStatistic s : values()) {
            if (s.code.equals(name == null ? null : name.trim().toLowerCase(Locale.ROOT))) {
                return s;
            }
        }
        throw new TauConfigurationException("Unknown tau statistic: " + name + " (expected mean, median or p75)");
    }
}
