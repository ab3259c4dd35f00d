package com.edge.precision.exception;

/**
 * tau 标定参数或输入报告集不合法
 */
public class TauConfigurationException extends PrecisionException {

    public TauConfigurationException(String message) {
        super(message);
    }

    public TauConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
