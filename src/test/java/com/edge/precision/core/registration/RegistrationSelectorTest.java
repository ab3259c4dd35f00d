package com.edge.precision.core.registration;

import com.edge.precision.core.distance.DistanceField;
import com.edge.precision.core.distance.DistanceFieldBuilder;
import com.edge.precision.core.model.ContourPoints;
import com.edge.precision.core.resample.ContourResampler;
import com.edge.precision.core.resample.SamplingPolicy;
import com.edge.precision.support.SyntheticImages;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RegistrationSelectorTest {
    private final RegistrationSelector selector = new RegistrationSelector(true);
    private final ContourResampler resampler = new ContourResampler();
    private final SamplingPolicy policy = SamplingPolicy.byStep(1.0, 20000);

    private final ContourPoints ideal = resampler.resample(SyntheticImages.square(50, 50, 100), policy);
    private final DistanceField field = new DistanceFieldBuilder(1).build(ideal, 200, 200);
    // 实测轮廓相对理想轮廓平移 (6, -4)
    private final ContourPoints real = resampler.resample(SyntheticImages.square(56, 46, 100), policy);

    @Test
    void select_picksCandidateWithLowestTrialMad() {
        List<RegistrationCandidate> candidates = List.of(
            RegistrationCandidate.success(RegistrationMethod.FEATURE_HOMOGRAPHY, HomographyTransform.translation(-3, 2)),
            RegistrationCandidate.success(RegistrationMethod.AXIS_FALLBACK, HomographyTransform.translation(-6, 4)),
            RegistrationCandidate.success(RegistrationMethod.IDENTITY, HomographyTransform.identity()));

        SelectedRegistration selected = selector.select(candidates, real, field);

        assertThat(selected.getMethod()).isEqualTo(RegistrationMethod.AXIS_FALLBACK);
        assertThat(selected.getTrialMadPx()).isCloseTo(0.0, within(1e-6));
        assertThat(selected.isDegraded()).isFalse();
        assertThat(selected.getEvaluations()).hasSize(3);
    }

    @Test
    void select_equalTrialMad_keepsHigherPriorityCandidate() {
        HomographyTransform exact = HomographyTransform.translation(-6, 4);
        List<RegistrationCandidate> candidates = List.of(
            RegistrationCandidate.success(RegistrationMethod.INTENSITY_ALIGNMENT, exact),
            RegistrationCandidate.success(RegistrationMethod.AXIS_FALLBACK, exact),
            RegistrationCandidate.success(RegistrationMethod.FEATURE_HOMOGRAPHY, exact));

        SelectedRegistration selected = selector.select(candidates, real, field);

        assertThat(selected.getMethod()).isEqualTo(RegistrationMethod.FEATURE_HOMOGRAPHY);
        // 缺失的恒等候选被补上
        assertThat(selected.getEvaluations()).hasSize(4);
    }

    @Test
    void select_allNonIdentityFailed_fallsBackToDegradedIdentity() {
        List<RegistrationCandidate> candidates = List.of(
            RegistrationCandidate.failure(RegistrationMethod.FEATURE_HOMOGRAPHY, "not_enough_matches"),
            RegistrationCandidate.failure(RegistrationMethod.AXIS_FALLBACK, "axis_detection_failed"),
            RegistrationCandidate.failure(RegistrationMethod.INTENSITY_ALIGNMENT, "ecc_failed"));

        SelectedRegistration selected = selector.select(candidates, real, field);

        assertThat(selected.getMethod()).isEqualTo(RegistrationMethod.IDENTITY);
        assertThat(selected.isDegraded()).isTrue();
        assertThat(selected.getTrialMadPx()).isGreaterThan(3.0);
        assertThat(selected.getEvaluations())
            .filteredOn(e -> !e.getCandidate().isValid())
            .allSatisfy(e -> assertThat(e.getTrialMadPx()).isNull());
    }

    @Test
    void select_worseCandidateThanIdentity_selectsIdentityWithoutDegrading() {
        List<RegistrationCandidate> candidates = List.of(
            RegistrationCandidate.success(RegistrationMethod.FEATURE_HOMOGRAPHY, HomographyTransform.translation(30, 30)),
            RegistrationCandidate.success(RegistrationMethod.IDENTITY, HomographyTransform.identity()));

        SelectedRegistration selected = selector.select(candidates, real, field);

        assertThat(selected.getMethod()).isEqualTo(RegistrationMethod.IDENTITY);
        assertThat(selected.isDegraded()).isFalse();
    }
}
