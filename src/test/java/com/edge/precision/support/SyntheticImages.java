package com.edge.precision.support;

import com.edge.precision.config.NativeLibraryLoader;
import com.edge.precision.core.model.ContourPoints;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.Random;

/**
 * 测试用合成轮廓与图像
 */
public final class SyntheticImages {

    private SyntheticImages() {
    }

    /**
     * 轴对齐正方形的四个顶点（顺时针）
     */
    public static ContourPoints square(double x0, double y0, double side) {
        return ContourPoints.of(new double[][]{
            {x0, y0}, {x0 + side, y0}, {x0 + side, y0 + side}, {x0, y0 + side}
        });
    }

    public static Mat blank(int width, int height) {
        NativeLibraryLoader.loadNativeLibraries();
        return new Mat(height, width, CvType.CV_8UC3, new Scalar(255, 255, 255));
    }

    /**
     * 白底黑色实心矩形（切割件）
     */
    public static Mat filledRect(int width, int height, int x0, int y0, int x1, int y1) {
        Mat image = blank(width, height);
        Imgproc.rectangle(image, new Point(x0, y0), new Point(x1, y1), new Scalar(0, 0, 0), -1);
        return image;
    }

    /**
     * 黑底白色 L 形坐标框架：水平臂沿 y = originY 向右，垂直臂沿 x = originX 向上
     */
    public static Mat axisFrame(int size, int originX, int originY, int armLength) {
        NativeLibraryLoader.loadNativeLibraries();
        Mat image = new Mat(size, size, CvType.CV_8UC1, new Scalar(0));
        Imgproc.rectangle(image, new Point(originX - 2, originY - 2), new Point(originX + armLength, originY + 2),
            new Scalar(255), -1);
        Imgproc.rectangle(image, new Point(originX - 2, originY - armLength), new Point(originX + 2, originY + 2),
            new Scalar(255), -1);
        return image;
    }

    /**
     * 平滑灰度图样：若干实心图形经高斯模糊，整体平移 (dx, dy)
     */
    public static Mat smoothPattern(int size, int dx, int dy) {
        NativeLibraryLoader.loadNativeLibraries();
        Mat image = new Mat(size, size, CvType.CV_8UC1, new Scalar(30));
        Imgproc.circle(image, new Point(70 + dx, 80 + dy), 30, new Scalar(220), -1);
        Imgproc.rectangle(image, new Point(120 + dx, 40 + dy), new Point(170 + dx, 110 + dy), new Scalar(160), -1);
        Imgproc.circle(image, new Point(140 + dx, 150 + dy), 22, new Scalar(250), -1);
        Imgproc.GaussianBlur(image, image, new org.opencv.core.Size(0, 0), 4.0);
        return image;
    }

    /**
     * 带大量角点的随机矩形纹理，整体平移 (dx, dy)；相同 seed 生成相同纹理
     */
    public static Mat texture(int size, int dx, int dy, long seed) {
        NativeLibraryLoader.loadNativeLibraries();
        Mat image = new Mat(size, size, CvType.CV_8UC1, new Scalar(128));
        Random random = new Random(seed);
        for (int i = 0; i < 120; i++) {
            int x = random.nextInt(size) + dx;
            int y = random.nextInt(size) + dy;
            int w = 6 + random.nextInt(30);
            int h = 6 + random.nextInt(30);
            Imgproc.rectangle(image, new Point(x, y), new Point(x + w, y + h), new Scalar(random.nextInt(256)), -1);
        }
        return image;
    }
}
