package com.edge.precision.exception;

/**
 * 轮廓退化：有效点数不足 3 或周长为零
 */
public class DegenerateContourException extends PrecisionException {

    public DegenerateContourException(String message) {
        super(message);
    }
}
