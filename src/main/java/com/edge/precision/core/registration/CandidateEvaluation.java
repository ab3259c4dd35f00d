package com.edge.precision.core.registration;

/**
 * 候选评估行：候选本身与其试算 MAD（无效候选为 null）
 */
public class CandidateEvaluation {
    private final RegistrationCandidate candidate;
    private final Double trialMadPx;

    public CandidateEvaluation(RegistrationCandidate candidate, Double trialMadPx) {
        this.candidate = candidate;
        this.trialMadPx = trialMadPx;
    }

    public RegistrationCandidate getCandidate() {
        return candidate;
    }

    public Double getTrialMadPx() {
        return trialMadPx;
    }

    @Override
    public String toString() {
        return String.format("%s -> trialMad=%s", candidate, trialMadPx);
    }
}
