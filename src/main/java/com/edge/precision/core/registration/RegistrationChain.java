package com.edge.precision.core.registration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 按优先级依次运行的配准生成器链，恒等生成器总在末尾
 */
public class RegistrationChain {
    private static final Logger logger = LoggerFactory.getLogger(RegistrationChain.class);

    private final List<RegistrationGenerator> generators;

    public RegistrationChain(List<RegistrationGenerator> generators) {
        List<RegistrationGenerator> ordered = new ArrayList<>(generators);
        if (ordered.stream().noneMatch(g -> g.getMethod() == RegistrationMethod.IDENTITY)) {
            ordered.add(new IdentityGenerator());
        }
        ordered.sort(Comparator.comparingInt(g -> g.getMethod().priority()));
        this.generators = Collections.unmodifiableList(ordered);
    }

    public List<RegistrationCandidate> produceAll(RegistrationInput input) {
        List<RegistrationCandidate> candidates = new ArrayList<>(generators.size());
        for (RegistrationGenerator generator : generators) {
            long start = System.currentTimeMillis();
            RegistrationCandidate candidate = generator.produceCandidate(input);
            logger.info("Registration candidate {}: valid={}, reason={} ({} ms)",
                generator.getMethod().getCode(), candidate.isValid(), candidate.getFailureReason(),
                System.currentTimeMillis() - start);
            candidates.add(candidate);
        }
        return candidates;
    }

    public List<RegistrationGenerator> getGenerators() {
        return generators;
    }
}
