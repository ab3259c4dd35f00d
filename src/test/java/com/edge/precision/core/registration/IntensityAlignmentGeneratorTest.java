package com.edge.precision.core.registration;

import com.edge.precision.config.PrecisionConfig;
import com.edge.precision.core.model.Point;
import com.edge.precision.support.SyntheticImages;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IntensityAlignmentGeneratorTest {

    @Test
    void produceCandidate_translatedPattern_mapsRealBackToIdeal() {
        PrecisionConfig.RegistrationConfig config = new PrecisionConfig.RegistrationConfig();
        config.setEccMotion("translation");
        IntensityAlignmentGenerator generator = new IntensityAlignmentGenerator(config);
        Mat ideal = SyntheticImages.smoothPattern(220, 0, 0);
        Mat real = SyntheticImages.smoothPattern(220, 3, 2);

        RegistrationCandidate candidate = generator.produceCandidate(new RegistrationInput(ideal, real));

        assertThat(candidate.isValid()).isTrue();
        assertThat(candidate.getConverged()).isTrue();
        assertThat(candidate.getCorrelation()).isGreaterThan(0.9);
        // 相关系数只记录在收敛字段，不冒充内点率
        assertThat(candidate.getInlierRatio()).isNull();
        Point mapped = candidate.getTransform().apply(new Point(103, 102));
        assertThat(mapped.x).isCloseTo(100.0, within(0.5));
        assertThat(mapped.y).isCloseTo(100.0, within(0.5));
    }

    @Test
    void motionModel_unknownName_isRejected() {
        assertThatThrownBy(() -> IntensityAlignmentGenerator.MotionModel.fromName("spline"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
