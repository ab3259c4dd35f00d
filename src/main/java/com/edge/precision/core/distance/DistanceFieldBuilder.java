package com.edge.precision.core.distance;

import com.edge.precision.config.NativeLibraryLoader;
import com.edge.precision.core.model.ContourPoints;
import com.edge.precision.util.MatConverter;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;

/**
 * 距离场构建器
 * <p>
 * 将理想轮廓以闭合折线绘入掩膜（轮廓像素为 0，其余为 255），
 * 再做精确欧氏距离变换
 */
public class DistanceFieldBuilder {
    private static final Logger logger = LoggerFactory.getLogger(DistanceFieldBuilder.class);

    private final int drawThickness;

    public DistanceFieldBuilder(int drawThickness) {
        NativeLibraryLoader.loadNativeLibraries();
        this.drawThickness = Math.max(1, drawThickness);
    }

    public DistanceField build(ContourPoints ideal, int width, int height) {
        if (ideal.size() < 2) {
            throw new IllegalArgumentException("Ideal contour needs at least 2 points to rasterize");
        }
        Mat mask = new Mat(height, width, CvType.CV_8UC1, new Scalar(255));
        Mat dist = new Mat();
        MatOfPoint polyline = MatConverter.toRoundedMatOfPoint(ideal.getPoints());
        try {
            // LINE_8 保证绘制像素与顶点一致
            Imgproc.polylines(mask, Collections.singletonList(polyline), true, new Scalar(0), drawThickness, Imgproc.LINE_8);
            Imgproc.distanceTransform(mask, dist, Imgproc.DIST_L2, Imgproc.DIST_MASK_PRECISE);
            float[] data = MatConverter.toFloatArray(dist);
            logger.debug("Distance field built: {}x{}, thickness={}", width, height, drawThickness);
            return new DistanceField(width, height, data);
        } finally {
            mask.release();
            dist.release();
            polyline.release();
        }
    }

    public int getDrawThickness() {
        return drawThickness;
    }
}
