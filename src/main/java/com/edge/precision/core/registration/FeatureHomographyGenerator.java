package com.edge.precision.core.registration;

import com.edge.precision.config.NativeLibraryLoader;
import com.edge.precision.config.PrecisionConfig;
import com.edge.precision.util.MatConverter;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.Core;
import org.opencv.core.DMatch;
import org.opencv.core.KeyPoint;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDMatch;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.features2d.DescriptorMatcher;
import org.opencv.features2d.ORB;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 特征点单应性配准 (ORB + Hamming KNN + Ratio Test + RANSAC)
 */
public class FeatureHomographyGenerator implements RegistrationGenerator {
    private static final Logger logger = LoggerFactory.getLogger(FeatureHomographyGenerator.class);

    private final PrecisionConfig.RegistrationConfig config;

    public FeatureHomographyGenerator(PrecisionConfig.RegistrationConfig config) {
        NativeLibraryLoader.loadNativeLibraries();
        this.config = config;
    }

    @Override
    public RegistrationMethod getMethod() {
        return RegistrationMethod.FEATURE_HOMOGRAPHY;
    }

    @Override
    public RegistrationCandidate produceCandidate(RegistrationInput input) {
        if (!input.hasImages()) {
            return RegistrationCandidate.failure(getMethod(), "missing_images");
        }

        Mat grayReal = null;
        Mat grayIdeal = null;
        MatOfKeyPoint kpReal = null;
        MatOfKeyPoint kpIdeal = null;
        Mat descReal = null;
        Mat descIdeal = null;
        Mat detectMask = new Mat();
        MatOfPoint2f matPtsReal = null;
        MatOfPoint2f matPtsIdeal = null;
        Mat mask = null;
        Mat hMatrix = null;

        try {
            grayReal = MatConverter.toGray(input.getRealImage());
            grayIdeal = MatConverter.toGray(input.getIdealImage());

            // 1. ORB 特征提取
            ORB orb = ORB.create(config.getOrbNfeatures());
            kpReal = new MatOfKeyPoint();
            kpIdeal = new MatOfKeyPoint();
            descReal = new Mat();
            descIdeal = new Mat();
            orb.detectAndCompute(grayReal, detectMask, kpReal, descReal);
            orb.detectAndCompute(grayIdeal, detectMask, kpIdeal, descIdeal);

            if (descReal.empty() || descIdeal.empty()) {
                return RegistrationCandidate.failure(getMethod(), "missing_descriptors");
            }

            // 2. 暴力 Hamming KNN 匹配 (实测 -> 理想)
            DescriptorMatcher matcher = DescriptorMatcher.create(DescriptorMatcher.BRUTEFORCE_HAMMING);
            List<MatOfDMatch> knnMatches = new ArrayList<>();
            matcher.knnMatch(descReal, descIdeal, knnMatches, 2);

            // 3. Ratio Test 筛选
            List<DMatch> goodMatches = new ArrayList<>();
            for (MatOfDMatch m : knnMatches) {
                DMatch[] dm = m.toArray();
                if (dm.length >= 2 && dm[0].distance < config.getKnnRatio() * dm[1].distance) {
                    goodMatches.add(dm[0]);
                }
                m.release();
            }
            int totalMatches = knnMatches.size();
            if (goodMatches.size() < config.getMinMatches()) {
                logger.debug("Feature registration: {} good matches < {}", goodMatches.size(), config.getMinMatches());
                return RegistrationCandidate.failure(getMethod(), "not_enough_matches")
                    .withMatches(totalMatches, goodMatches.size());
            }

            // 4. RANSAC 单应性
            List<org.opencv.core.Point> ptsReal = new ArrayList<>();
            List<org.opencv.core.Point> ptsIdeal = new ArrayList<>();
            List<KeyPoint> kpRealList = kpReal.toList();
            List<KeyPoint> kpIdealList = kpIdeal.toList();
            for (DMatch m : goodMatches) {
                ptsReal.add(kpRealList.get(m.queryIdx).pt);
                ptsIdeal.add(kpIdealList.get(m.trainIdx).pt);
            }
            matPtsReal = new MatOfPoint2f();
            matPtsReal.fromList(ptsReal);
            matPtsIdeal = new MatOfPoint2f();
            matPtsIdeal.fromList(ptsIdeal);
            mask = new Mat();

            // 固定随机种子，保证同一输入结果可复现
            Core.setRNGSeed((int) config.getRngSeed());
            hMatrix = Calib3d.findHomography(matPtsReal, matPtsIdeal, Calib3d.RANSAC,
                config.getRansacReprojThreshold(), mask);

            if (hMatrix == null || hMatrix.empty()) {
                return RegistrationCandidate.failure(getMethod(), "homography_failed")
                    .withMatches(totalMatches, goodMatches.size());
            }
            HomographyTransform transform = HomographyTransform.fromMat(hMatrix);
            if (!transform.isFinite()) {
                return RegistrationCandidate.failure(getMethod(), "homography_failed")
                    .withMatches(totalMatches, goodMatches.size());
            }

            // 5. 内点率与重投影误差
            int inliers = 0;
            double errorSum = 0.0;
            for (int i = 0; i < ptsReal.size(); i++) {
                if (mask.get(i, 0)[0] != 0) {
                    inliers++;
                    org.opencv.core.Point src = ptsReal.get(i);
                    org.opencv.core.Point dst = ptsIdeal.get(i);
                    com.edge.precision.core.model.Point projected =
                        transform.apply(new com.edge.precision.core.model.Point(src.x, src.y));
                    errorSum += Math.hypot(projected.x - dst.x, projected.y - dst.y);
                }
            }
            double inlierRatio = (double) inliers / goodMatches.size();
            Double reprojectionError = inliers > 0 ? errorSum / inliers : null;

            if (inlierRatio < config.getMinInlierRatio()) {
                return RegistrationCandidate.rejected(getMethod(), transform, "low_inlier_ratio")
                    .withMatches(totalMatches, goodMatches.size())
                    .withInlierRatio(inlierRatio)
                    .withReprojectionError(reprojectionError);
            }

            logger.debug("Feature registration: matches={}, inlierRatio={}", goodMatches.size(), inlierRatio);
            return RegistrationCandidate.success(getMethod(), transform)
                .withMatches(totalMatches, goodMatches.size())
                .withInlierRatio(inlierRatio)
                .withReprojectionError(reprojectionError);

        } catch (Exception e) {
            logger.warn("Feature registration failed: {}", e.getMessage());
            return RegistrationCandidate.failure(getMethod(), "homography_failed");
        } finally {
            if (grayReal != null) grayReal.release();
            if (grayIdeal != null) grayIdeal.release();
            if (kpReal != null) kpReal.release();
            if (kpIdeal != null) kpIdeal.release();
            if (descReal != null) descReal.release();
            if (descIdeal != null) descIdeal.release();
            detectMask.release();
            if (matPtsReal != null) matPtsReal.release();
            if (matPtsIdeal != null) matPtsIdeal.release();
            if (mask != null) mask.release();
            if (hMatrix != null) hMatrix.release();
        }
    }
}
