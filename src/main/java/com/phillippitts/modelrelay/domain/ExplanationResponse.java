package com.phillippitts.modelrelay.domain;

import java.util.List;
import java.util.Objects;

/** Result of a code explanation request. */
public record ExplanationResponse(String explanation, List<String> examples, List<String> relatedConcepts) {

    public ExplanationResponse {
        Objects.requireNonNull(explanation, "explanation must not be null");
        examples = examples == null ? List.of() : List.copyOf(examples);
        relatedConcepts = relatedConcepts == null ? List.of() : List.copyOf(relatedConcepts);
    }
}
