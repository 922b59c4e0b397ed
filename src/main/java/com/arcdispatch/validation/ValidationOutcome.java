package com.arcdispatch.validation;

import com.arcdispatch.models.AnswerDetails;
import com.arcdispatch.models.ErrorKind;
import com.arcdispatch.models.PredictionValidation;

import java.util.Collections;
import java.util.List;

/**
 * Either a scored validation or a count mismatch. The grids that were found are kept in both cases.
 */
public class ValidationOutcome {

    private final PredictionValidation validation;
    private final List<int[][]> foundGrids;
    private final int expectedCount;
    private final String errorDetail;
    private final AnswerDetails answerDetails;

    private ValidationOutcome(PredictionValidation validation, List<int[][]> foundGrids,
                              int expectedCount, String errorDetail, AnswerDetails answerDetails) {
        this.validation = validation;
        this.answerDetails = answerDetails;
        this.foundGrids = foundGrids != null ? Collections.unmodifiableList(foundGrids) : Collections.emptyList();
        this.expectedCount = expectedCount;
        this.errorDetail = errorDetail;
    }

    public static ValidationOutcome valid(PredictionValidation validation, AnswerDetails answerDetails) {
        return new ValidationOutcome(validation, validation.getPredictedGrids(), validation.getCorrect().size(), null,
            answerDetails);
    }

    public static ValidationOutcome countMismatch(List<int[][]> foundGrids, int expectedCount,
                                                  AnswerDetails answerDetails) {
        int found = foundGrids == null ? 0 : foundGrids.size();
        String detail = "Expected " + expectedCount + " predicted grid(s), found " + found;
        return new ValidationOutcome(null, foundGrids, expectedCount, detail, answerDetails);
    }

    public boolean isValid() {
        return validation != null;
    }

    public PredictionValidation getValidation() {
        return validation;
    }

    public List<int[][]> getFoundGrids() {
        return foundGrids;
    }

    public int getExpectedCount() {
        return expectedCount;
    }

    /** {@link ErrorKind#PREDICTION_COUNT_MISMATCH} on failure, otherwise null. */
    public ErrorKind getErrorKind() {
        return validation == null ? ErrorKind.PREDICTION_COUNT_MISMATCH : null;
    }

    /** Explanatory fields of the answer object the grids came from, or null. */
    public AnswerDetails getAnswerDetails() {
        return answerDetails;
    }

    public String getErrorDetail() {
        return errorDetail;
    }
}
