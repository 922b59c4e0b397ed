package com.arcdispatch.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.List;

/**
 * The explanatory fields of a structured answer, stored next to the predicted grids.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnswerDetails {

    public static final int MAX_HINTS = 10;

    private final String patternDescription;
    private final String solvingStrategy;
    private final List<String> hints;
    private final Integer confidence;

    public AnswerDetails(String patternDescription, String solvingStrategy, List<String> hints, Integer confidence) {
        this.patternDescription = patternDescription;
        this.solvingStrategy = solvingStrategy;
        this.hints = hints != null ? List.copyOf(hints) : Collections.emptyList();
        this.confidence = confidence;
    }

    public String getPatternDescription() {
        return patternDescription;
    }

    public String getSolvingStrategy() {
        return solvingStrategy;
    }

    public List<String> getHints() {
        return hints;
    }

    /** 0 to 100, or null when the answer gave none. */
    public Integer getConfidence() {
        return confidence;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return patternDescription == null && solvingStrategy == null && hints.isEmpty() && confidence == null;
    }
}
