package com.edge.precision.core.registration;

import com.edge.precision.config.PrecisionConfig;
import com.edge.precision.core.model.Point;
import com.edge.precision.support.SyntheticImages;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureHomographyGeneratorTest {
    private final FeatureHomographyGenerator generator = new FeatureHomographyGenerator(new PrecisionConfig.RegistrationConfig());

    @Test
    void produceCandidate_featurelessImages_isInvalid() {
        Mat blank = SyntheticImages.blank(200, 200);

        RegistrationCandidate candidate = generator.produceCandidate(new RegistrationInput(blank, blank));

        assertThat(candidate.isValid()).isFalse();
        assertThat(candidate.getFailureReason()).isIn("missing_descriptors", "not_enough_matches");
    }

    @Test
    void produceCandidate_translatedTexture_recoversShiftAndKeepsInputs() {
        Mat ideal = SyntheticImages.texture(320, 0, 0, 7L);
        Mat real = SyntheticImages.texture(320, 5, 3, 7L);

        RegistrationCandidate first = generator.produceCandidate(new RegistrationInput(ideal, real));
        RegistrationCandidate second = generator.produceCandidate(new RegistrationInput(ideal, real));

        assertThat(first.isValid()).isTrue();
        assertThat(first.getMatchesUsed()).isGreaterThanOrEqualTo(20);
        assertThat(first.getInlierRatio()).isGreaterThan(0.5);
        Point mapped = first.getTransform().apply(new Point(165, 163));
        assertThat(mapped.x).isCloseTo(160.0, within(1.5));
        assertThat(mapped.y).isCloseTo(160.0, within(1.5));
        // 固定种子，重复运行结果一致；输入图像不被释放
        assertThat(second.getTransform().toRows()).isDeepEqualTo(first.getTransform().toRows());
        assertThat(ideal.empty()).isFalse();
        assertThat(real.empty()).isFalse();
    }

    @Test
    void produceCandidate_withoutImages_failsFast() {
        RegistrationCandidate candidate = generator.produceCandidate(RegistrationInput.withoutImages());

        assertThat(candidate.getFailureReason()).isEqualTo("missing_images");
    }
}
