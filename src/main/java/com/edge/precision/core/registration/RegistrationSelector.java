package com.edge.precision.core.registration;

import com.edge.precision.core.distance.DistanceField;
import com.edge.precision.core.model.ContourPoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 配准选择器
 * <p>
 * 对每个有效候选，将变换作用于重采样后的实测轮廓并在距离场上求平均距离（试算 MAD），
 * 取最小者；平局时保留优先级靠前的候选
 */
public class RegistrationSelector {
    private static final Logger logger = LoggerFactory.getLogger(RegistrationSelector.class);

    private final boolean useBilinear;

    public RegistrationSelector(boolean useBilinear) {
        this.useBilinear = useBilinear;
    }

    public SelectedRegistration select(List<RegistrationCandidate> candidates, ContourPoints realResampled,
                                       DistanceField field) {
        List<RegistrationCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingInt(c -> c.getMethod().priority()));
        if (ordered.stream().noneMatch(c -> c.getMethod() == RegistrationMethod.IDENTITY)) {
            ordered.add(new IdentityGenerator().produceCandidate(RegistrationInput.withoutImages()));
        }

        List<CandidateEvaluation> evaluations = new ArrayList<>();
        RegistrationCandidate best = null;
        double bestMad = Double.POSITIVE_INFINITY;
        boolean anyNonIdentityValid = false;

        for (RegistrationCandidate candidate : ordered) {
            if (!candidate.isValid()) {
                evaluations.add(new CandidateEvaluation(candidate, null));
                continue;
            }
            if (candidate.getMethod() != RegistrationMethod.IDENTITY) {
                anyNonIdentityValid = true;
            }
            double trialMad = field.sample(candidate.getTransform().apply(realResampled).getPoints(), useBilinear).mean();
            evaluations.add(new CandidateEvaluation(candidate, trialMad));
            logger.debug("Candidate {} trial MAD: {}", candidate.getMethod().getCode(), trialMad);
            // 严格小于：平局保留先出现的（高优先级）候选
            if (Double.isFinite(trialMad) && trialMad < bestMad) {
                bestMad = trialMad;
                best = candidate;
            }
        }

        if (!anyNonIdentityValid || best == null) {
            RegistrationCandidate identity = ordered.stream()
                .filter(c -> c.getMethod() == RegistrationMethod.IDENTITY)
                .findFirst()
                .orElseThrow(IllegalStateException::new);
            double identityMad = evaluations.stream()
                .filter(e -> e.getCandidate() == identity && e.getTrialMadPx() != null)
                .mapToDouble(CandidateEvaluation::getTrialMadPx)
                .findFirst()
                .orElse(Double.NaN);
            logger.warn("All registration methods failed, falling back to identity (degraded)");
            return new SelectedRegistration(identity, identityMad, true, evaluations);
        }

        logger.info("Registration selected: method={}, trialMad={}", best.getMethod().getCode(), bestMad);
        return new SelectedRegistration(best, bestMad, false, evaluations);
    }
}
