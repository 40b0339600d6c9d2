package com.phillippitts.modelrelay.domain;

import java.util.List;
import java.util.Objects;

/**
 * Result of a code analysis.
 *
 * @param analysis    free-form findings
 * @param suggestions concrete improvement suggestions, possibly empty
 * @param confidence  provider confidence between 0.0 and 1.0
 */
public record AnalysisResponse(String analysis, List<String> suggestions, double confidence) {

    public AnalysisResponse {
        Objects.requireNonNull(analysis, "analysis must not be null");
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
