package com.edge.precision.core.registration;

import java.util.Collections;
import java.util.List;

/**
 * 选中的配准结果
 * <p>
 * degraded 表示所有非恒等方法均失败、回退到恒等变换（低置信度）
 */
public class SelectedRegistration {
    private final RegistrationCandidate selected;
    private final double trialMadPx;
    private final boolean degraded;
    private final List<CandidateEvaluation> evaluations;

    public SelectedRegistration(RegistrationCandidate selected, double trialMadPx, boolean degraded,
                                List<CandidateEvaluation> evaluations) {
        this.selected = selected;
        this.trialMadPx = trialMadPx;
        this.degraded = degraded;
        this.evaluations = Collections.unmodifiableList(evaluations);
    }

    public RegistrationCandidate getSelected() {
        return selected;
    }

    public RegistrationMethod getMethod() {
        return selected.getMethod();
    }

    public HomographyTransform getTransform() {
        return selected.getTransform();
    }

    public double getTrialMadPx() {
        return trialMadPx;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public List<CandidateEvaluation> getEvaluations() {
        return evaluations;
    }

    @Override
    public String toString() {
        return String.format("SelectedRegistration[%s, trialMad=%.4f, degraded=%s]",
            selected.getMethod().getCode(), trialMadPx, degraded);
    }
}
