package com.edge.precision.exception;

/**
 * 精度测量异常基类
 */
public class PrecisionException extends RuntimeException {

    public PrecisionException(String message) {
        super(message);
    }

    public PrecisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
