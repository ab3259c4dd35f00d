package com.edge.precision.service;

import com.edge.precision.core.model.ContourPoints;
import com.edge.precision.core.resample.SamplingPolicy;
import lombok.Data;
import org.opencv.core.Mat;

/**
 * 核心比对输入：两条轮廓、可选的原图、理想图尺寸与本次运行参数
 */
@Data
public class ComparisonInput {
    private ContourPoints idealContour;
    private ContourPoints realContour;
    // 可为 null：此时图像类配准方法失败，只剩恒等变换
    private Mat idealImage;
    private Mat realImage;
    private int width;
    private int height;

    private double tau;
    private SamplingPolicy samplingPolicy;
    private Double manualMmPerPx;
    private Boolean validateWithKdtree;
}
