package com.edge.precision.core.extract;

import org.opencv.core.Mat;

/**
 * 轮廓提取器
 */
public interface ContourExtractor {

    ExtractionResult extract(Mat image);
}
