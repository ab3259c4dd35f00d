package com.edge.precision.core.registration;

import com.edge.precision.config.PrecisionConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RegistrationChainTest {

    @Test
    void constructor_ordersByPriorityAndAppendsIdentity() {
        PrecisionConfig.RegistrationConfig config = new PrecisionConfig.RegistrationConfig();
        RegistrationChain chain = new RegistrationChain(List.of(
            new IntensityAlignmentGenerator(config),
            new FeatureHomographyGenerator(config)));

        assertThat(chain.getGenerators())
            .extracting(RegistrationGenerator::getMethod)
            .containsExactly(RegistrationMethod.FEATURE_HOMOGRAPHY, RegistrationMethod.INTENSITY_ALIGNMENT,
                RegistrationMethod.IDENTITY);
    }

    @Test
    void produceAll_withoutImages_onlyIdentityIsValid() {
        PrecisionConfig.RegistrationConfig config = new PrecisionConfig.RegistrationConfig();
        RegistrationChain chain = new RegistrationChain(List.of(
            new FeatureHomographyGenerator(config),
            new AxisFallbackGenerator(config),
            new IntensityAlignmentGenerator(config)));

        List<RegistrationCandidate> candidates = chain.produceAll(RegistrationInput.withoutImages());

        assertThat(candidates).hasSize(4);
        assertThat(candidates).filteredOn(RegistrationCandidate::isValid)
            .extracting(RegistrationCandidate::getMethod)
            .containsExactly(RegistrationMethod.IDENTITY);
    }
}
