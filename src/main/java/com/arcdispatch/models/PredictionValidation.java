package com.arcdispatch.models;

import java.util.Collections;
import java.util.List;

/**
 * Score of one completed answer: one predicted grid and one correctness flag per test case.
 */
public final class PredictionValidation {

    private final List<int[][]> predictedGrids;
    private final List<Boolean> correct;
    private final double accuracy;
    private final ExtractionMethod extractionMethod;

    public PredictionValidation(List<int[][]> predictedGrids, List<Boolean> correct, ExtractionMethod extractionMethod) {
        if (predictedGrids.size() != correct.size()) {
            throw new IllegalArgumentException("Grid count " + predictedGrids.size()
                + " does not match flag count " + correct.size());
        }
        this.predictedGrids = Collections.unmodifiableList(predictedGrids);
        this.correct = List.copyOf(correct);
        this.extractionMethod = extractionMethod;
        long hits = correct.stream().filter(Boolean::booleanValue).count();
        this.accuracy = correct.isEmpty() ? 0.0 : (double) hits / correct.size();
    }

    public List<int[][]> getPredictedGrids() {
        return predictedGrids;
    }

    public List<Boolean> getCorrect() {
        return correct;
    }

    public double getAccuracy() {
        return accuracy;
    }

    public ExtractionMethod getExtractionMethod() {
        return extractionMethod;
    }

    public boolean isAllCorrect() {
        return !correct.isEmpty() && correct.stream().allMatch(Boolean::booleanValue);
    }
}
