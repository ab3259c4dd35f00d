package com.edge.precision.core.registration;

/**
 * 配准方法，声明顺序即优先级（平局时靠前者胜出）
 */
public enum RegistrationMethod {
    FEATURE_HOMOGRAPHY("orb_homography"),
    AXIS_FALLBACK("axes_fallback"),
    INTENSITY_ALIGNMENT("ecc_fallback"),
    IDENTITY("identity");

    private final String code;

    RegistrationMethod(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public int priority() {
        return ordinal();
    }
}
