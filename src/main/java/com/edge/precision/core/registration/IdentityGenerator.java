package com.edge.precision.core.registration;

/**
 * 恒等变换，总是有效，作为最后兜底
 */
public class IdentityGenerator implements RegistrationGenerator {

    @Override
    public RegistrationMethod getMethod() {
        return RegistrationMethod.IDENTITY;
    }

    @Override
    public RegistrationCandidate produceCandidate(RegistrationInput input) {
        return RegistrationCandidate.success(RegistrationMethod.IDENTITY, HomographyTransform.identity());
    }
}
