package com.edge.precision.core.calibration;

import com.edge.precision.config.PrecisionConfig;
import com.edge.precision.support.SyntheticImages;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScaleCalibratorTest {
    private final ScaleCalibrator calibrator = new ScaleCalibrator(new PrecisionConfig.CalibrationConfig());

    @Test
    void calibrate_manualOverride_winsOverImage() {
        ScaleCalibration calibration = calibrator.calibrate(SyntheticImages.blank(100, 100), 0.05);

        assertThat(calibration.getStatus()).isEqualTo(ScaleCalibration.Status.MANUAL);
        assertThat(calibration.getMethod()).isEqualTo("manual");
        assertThat(calibration.getMmPerPx()).isEqualTo(0.05);
        assertThat(calibration.toMm(10.0)).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void calibrate_configuredManualScale_isUsedWithoutOverride() {
        PrecisionConfig.CalibrationConfig config = new PrecisionConfig.CalibrationConfig();
        config.setManualMmPerPx(0.2);

        ScaleCalibration calibration = new ScaleCalibrator(config).calibrate(null, null);

        assertThat(calibration.getMmPerPx()).isEqualTo(0.2);
    }

    @Test
    void calibrate_nonPositiveManualScale_isRejected() {
        assertThatThrownBy(() -> calibrator.calibrate(null, -1.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void calibrate_noImage_isMissing() {
        ScaleCalibration calibration = calibrator.calibrate(null, null);

        assertThat(calibration.getStatus()).isEqualTo(ScaleCalibration.Status.MISSING);
        assertThat(calibration.isCalibrated()).isFalse();
        assertThat(calibration.toMm(10.0)).isNull();
        assertThat(calibration.getDetails()).containsEntry("reason", "no_image");
    }

    @Test
    void calibrate_blankImage_findsNoRuler() {
        ScaleCalibration calibration = calibrator.calibrate(SyntheticImages.blank(200, 200), null);

        assertThat(calibration.getStatus()).isEqualTo(ScaleCalibration.Status.MISSING);
        assertThat(calibration.getDetails()).containsEntry("reason", "no_ruler_lines");
    }

    @Test
    void calibrate_rulerBar_derivesScaleFromItsLength() {
        // 240 px 长的标尺，默认代表 120 mm
        Mat image = SyntheticImages.blank(400, 400);
        Imgproc.rectangle(image, new Point(80, 199), new Point(319, 201), new Scalar(0, 0, 0), -1);

        ScaleCalibration calibration = calibrator.calibrate(image, null);

        assertThat(calibration.getStatus()).isEqualTo(ScaleCalibration.Status.RESOLVED);
        assertThat(calibration.getMethod()).isEqualTo("ruler_detection");
        assertThat(calibration.getMmPerPx()).isCloseTo(0.5, within(0.025));
    }

    @Test
    void statusCodes_distinguishResolvedManualAndMissing() {
        assertThat(ScaleCalibration.Status.RESOLVED.getCode()).isEqualTo("resolved");
        assertThat(ScaleCalibration.Status.MANUAL.getCode()).isEqualTo("manual");
        assertThat(ScaleCalibration.Status.MISSING.getCode()).isEqualTo("missing");
    }

    @Test
    void median_evenCount_averagesMiddleValues() {
        assertThat(ScaleCalibrator.median(List.of(4.0, 1.0, 3.0, 2.0))).isEqualTo(2.5);
    }
}
