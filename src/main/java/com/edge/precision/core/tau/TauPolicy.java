package com.edge.precision.core.tau;

import com.edge.precision.exception.TauConfigurationException;

import java.util.Locale;

/**
 * 预置策略
 */
public enum TauPolicy {
    STRICT("strict") {
        @Override
        public LabeledPolicy preset() {
            return new LabeledPolicy(getCode(), TauObjective.MIN_FALSE_POSITIVE, 15.0, 20.0, 0.80, 0.95);
        }
    },
    BALANCED("balanced") {
        @Override
        public LabeledPolicy preset() {
            return new LabeledPolicy(getCode(), TauObjective.BALANCED_ACCURACY_THEN_GAP, 25.0, 10.0, null, null);
        }
    },
    LENIENT("lenient") {
        @Override
        public LabeledPolicy preset() {
            return new LabeledPolicy(getCode(), TauObjective.BALANCED_ACCURACY, 40.0, 5.0, 0.60, 0.80);
        }
    },
    CUSTOM("custom") {
        @Override
        public LabeledPolicy preset() {
            return new LabeledPolicy(getCode(), TauObjective.BALANCED_ACCURACY_THEN_GAP, null, null, null, null);
        }
    };

    private final String code;

    TauPolicy(String code) {
        this.code = code;
    }

    public abstract LabeledPolicy preset();

    public String getCode() {
        return code;
    }

    public static TauPolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            return CUSTOM;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (TauPolicy p : values()) {
            if (p.code.equals(normalized)) {
                return p;
            }
        }
        throw new TauConfigurationException("Unknown tau policy: " + name + " (expected strict, balanced, lenient or custom)");
    }
}
