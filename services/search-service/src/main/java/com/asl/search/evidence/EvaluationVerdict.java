package com.asl.search.evidence;

import java.util.List;

public class EvaluationVerdict {
    private final boolean answered;
    private final double confidence;
    private final List<String> missingFacts;

    public EvaluationVerdict(boolean answered, double confidence, List<String> missingFacts) {
        this.answered = answered;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.missingFacts = missingFacts == null ? List.of() : List.copyOf(missingFacts);
    }

    public static EvaluationVerdict neutral() {
        return new EvaluationVerdict(false, 0.0, List.of());
    }

    public boolean isConverged(double threshold) {
        return answered && confidence >= threshold;
    }

    public boolean isAnswered() {
        return answered;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<String> getMissingFacts() {
        return missingFacts;
    }
}
