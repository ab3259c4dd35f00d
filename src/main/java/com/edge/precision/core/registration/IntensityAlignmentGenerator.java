package com.edge.precision.core.registration;

import com.edge.precision.config.NativeLibraryLoader;
import com.edge.precision.config.PrecisionConfig;
import com.edge.precision.util.MatConverter;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.core.TermCriteria;
import org.opencv.imgproc.Imgproc;
import org.opencv.video.Video;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * 灰度 ECC 配准
 * <p>
 * 实测图缩放到理想图尺寸后求 ECC 形变。ECC 形变把理想坐标映射到实测坐标，
 * 候选变换为其逆再复合缩放
 */
public class IntensityAlignmentGenerator implements RegistrationGenerator {
    private static final Logger logger = LoggerFactory.getLogger(IntensityAlignmentGenerator.class);

    private static final int GAUSS_FILT_SIZE = 5;

    /**
     * ECC 运动模型
     */
    public enum MotionModel {
        TRANSLATION(Video.MOTION_TRANSLATION),
        EUCLIDEAN(Video.MOTION_EUCLIDEAN),
        AFFINE(Video.MOTION_AFFINE),
        HOMOGRAPHY(Video.MOTION_HOMOGRAPHY);

        private final int cvCode;

        MotionModel(int cvCode) {
            this.cvCode = cvCode;
        }

        public int getCvCode() {
            return cvCode;
        }

        public static MotionModel fromName(String name) {
            if (name == null) {
                return AFFINE;
            }
            try {
                return MotionModel.valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unsupported ECC motion: " + name, e);
            }
        }
    }

    private final PrecisionConfig.RegistrationConfig config;
    private final MotionModel motion;

    public IntensityAlignmentGenerator(PrecisionConfig.RegistrationConfig config) {
        NativeLibraryLoader.loadNativeLibraries();
        this.config = config;
        this.motion = MotionModel.fromName(config.getEccMotion());
    }

    @Override
    public RegistrationMethod getMethod() {
        return RegistrationMethod.INTENSITY_ALIGNMENT;
    }

    @Override
    public RegistrationCandidate produceCandidate(RegistrationInput input) {
        if (!input.hasImages()) {
            return RegistrationCandidate.failure(getMethod(), "missing_images");
        }

        Mat grayIdeal = null;
        Mat grayReal = null;
        Mat resized = new Mat();
        Mat idealF = new Mat();
        Mat realF = new Mat();
        Mat eccMask = new Mat();
        Mat warp = null;
        try {
            grayIdeal = MatConverter.toGray(input.getIdealImage());
            grayReal = MatConverter.toGray(input.getRealImage());
            int w = grayIdeal.cols();
            int h = grayIdeal.rows();
            double sx = (double) w / grayReal.cols();
            double sy = (double) h / grayReal.rows();

            Imgproc.resize(grayReal, resized, new Size(w, h), 0, 0, Imgproc.INTER_LINEAR);
            grayIdeal.convertTo(idealF, CvType.CV_32F, 1.0 / 255.0);
            resized.convertTo(realF, CvType.CV_32F, 1.0 / 255.0);

            warp = motion == MotionModel.HOMOGRAPHY
                ? Mat.eye(3, 3, CvType.CV_32F)
                : Mat.eye(2, 3, CvType.CV_32F);
            TermCriteria criteria = new TermCriteria(TermCriteria.EPS + TermCriteria.COUNT,
                config.getEccIterations(), config.getEccEps());

            double cc = Video.findTransformECC(idealF, realF, warp, motion.getCvCode(), criteria, eccMask, GAUSS_FILT_SIZE);

            HomographyTransform eccWarp = HomographyTransform.fromMat(warp);
            if (!eccWarp.isFinite() || Math.abs(eccWarp.determinant()) < 1e-12) {
                return RegistrationCandidate.failure(getMethod(), "ecc_failed");
            }
            // 实测原图 -> 缩放图 -> 理想坐标
            HomographyTransform transform = eccWarp.inverse().multiply(HomographyTransform.scale(sx, sy));

            logger.debug("ECC registration: motion={}, cc={}", motion, cc);
            return RegistrationCandidate.success(getMethod(), transform)
                .withConvergence(true, cc);
        } catch (Exception e) {
            // 不收敛时 OpenCV 抛出 CvException
            logger.warn("ECC registration failed: {}", e.getMessage());
            return RegistrationCandidate.failure(getMethod(), "ecc_failed")
                .withConvergence(false, null);
        } finally {
            if (grayIdeal != null) grayIdeal.release();
            if (grayReal != null) grayReal.release();
            resized.release();
            idealF.release();
            realF.release();
            eccMask.release();
            if (warp != null) warp.release();
        }
    }

    public MotionModel getMotion() {
        return motion;
    }
}
