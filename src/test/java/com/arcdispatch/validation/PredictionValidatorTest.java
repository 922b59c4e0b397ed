package com.arcdispatch.validation;

import com.arcdispatch.models.AnswerDetails;
import com.arcdispatch.models.ErrorKind;
import com.arcdispatch.models.ExtractionMethod;
import com.arcdispatch.models.PredictionValidation;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PredictionValidatorTest {

    private final PredictionValidator validator = new PredictionValidator(new ObjectMapper());

    private static List<int[][]> expected(int[][]... grids) {
        List<int[][]> list = new ArrayList<>();
        for (int[][] grid : grids) {
            list.add(grid);
        }
        return list;
    }

    @Test
    void exactSingleGridIsCorrect() {
        ValidationOutcome outcome = validator.validate("{\"predictedOutput\": [[1]]}", expected(new int[][]{{1}}));

        assertTrue(outcome.isValid());
        PredictionValidation validation = outcome.getValidation();
        assertEquals(List.of(true), validation.getCorrect());
        assertEquals(1.0, validation.getAccuracy());
        assertEquals(ExtractionMethod.DIRECT_FIELD, validation.getExtractionMethod());
        assertTrue(validation.isAllCorrect());
    }

    @Test
    void wrongCellIsIncorrect() {
        ValidationOutcome outcome = validator.validate("{\"predictedOutput\": [[0]]}", expected(new int[][]{{1}}));

        assertTrue(outcome.isValid());
        assertEquals(List.of(false), outcome.getValidation().getCorrect());
        assertEquals(0.0, outcome.getValidation().getAccuracy());
    }

    @Test
    void singleGridForTwoTestsIsCountMismatch() {
        ValidationOutcome outcome = validator.validate("{\"predictedOutput\": [[1]]}",
            expected(new int[][]{{1}}, new int[][]{{2}}));

        assertFalse(outcome.isValid());
        assertEquals(ErrorKind.PREDICTION_COUNT_MISMATCH, outcome.getErrorKind());
        assertEquals(1, outcome.getFoundGrids().size());
        assertEquals(2, outcome.getExpectedCount());
    }

    @Test
    void readsAnswerInsideCodeFence() {
        String text = "Here is my answer:\n```json\n{\"predictedOutput\": [[1,2],[3,4]]}\n```\nDone.";
        ValidationOutcome outcome = validator.validate(text, expected(new int[][]{{1, 2}, {3, 4}}));

        assertTrue(outcome.isValid());
        assertTrue(outcome.getValidation().isAllCorrect());
        assertEquals(ExtractionMethod.DIRECT_FIELD, outcome.getValidation().getExtractionMethod());
    }

    @Test
    void readsAnswerObjectEmbeddedInProse() {
        String text = "I think the rule is mirroring. {\"patternDescription\": \"mirror\", \"predictedOutput\": [[2,1]]} Hope that helps.";
        ValidationOutcome outcome = validator.validate(text, expected(new int[][]{{2, 1}}));

        assertTrue(outcome.isValid());
        assertTrue(outcome.getValidation().isAllCorrect());
    }

    @Test
    void readsNumberedOutputsBehindBooleanFlag() {
        String text = "{\"multiplePredictedOutputs\": true, \"predictedOutput1\": [[1]], \"predictedOutput2\": [[3]]}";
        ValidationOutcome outcome = validator.validate(text, expected(new int[][]{{1}}, new int[][]{{2}}));

        assertTrue(outcome.isValid());
        assertEquals(List.of(true, false), outcome.getValidation().getCorrect());
        assertEquals(0.5, outcome.getValidation().getAccuracy());
    }

    @Test
    void readsListOfOutputs() {
        String text = "{\"multiplePredictedOutputs\": [[[1]], [[2]]]}";
        ValidationOutcome outcome = validator.validate(text, expected(new int[][]{{1}}, new int[][]{{2}}));

        assertTrue(outcome.isValid());
        assertTrue(outcome.getValidation().isAllCorrect());
    }

    @Test
    void acceptsLegacyFieldName() {
        ValidationOutcome outcome = validator.validate("{\"predicted_output_grid\": [[7]]}", expected(new int[][]{{7}}));

        assertTrue(outcome.isValid());
        assertTrue(outcome.getValidation().isAllCorrect());
    }

    @Test
    void recoversGridFromPlainText() {
        String text = "The output is [[1, 2], [3, 4]] after the transformation.";
        ValidationOutcome outcome = validator.validate(text, expected(new int[][]{{1, 2}, {3, 4}}));

        assertTrue(outcome.isValid());
        assertEquals(ExtractionMethod.TEXT_RECOVERY, outcome.getValidation().getExtractionMethod());
        assertTrue(outcome.getValidation().isAllCorrect());
    }

    @Test
    void textRecoveryPrefersLastGrids() {
        String text = "First attempt [[0]] but on reflection the final answer is [[5]]";
        ValidationOutcome outcome = validator.validate(text, expected(new int[][]{{5}}));

        assertTrue(outcome.isValid());
        assertTrue(outcome.getValidation().isAllCorrect());
    }

    @Test
    void cellsAboveNineAreNotGrids() {
        ValidationOutcome outcome = validator.validate("{\"predictedOutput\": [[10]]}", expected(new int[][]{{1}}));

        assertFalse(outcome.isValid());
        assertTrue(outcome.getFoundGrids().isEmpty());
    }

    @Test
    void cellsBeyondIntRangeAreNotNarrowed() {
        ValidationOutcome wide = validator.validate("{\"predictedOutput\": [[4294967297]]}", expected(new int[][]{{1}}));
        ValidationOutcome huge = validator.validate("{\"predictedOutput\": [[18446744073709551617]]}",
            expected(new int[][]{{1}}));

        assertFalse(wide.isValid());
        assertTrue(wide.getFoundGrids().isEmpty());
        assertFalse(huge.isValid());
        assertTrue(huge.getFoundGrids().isEmpty());
    }

    @Test
    void raggedRowsAreNotGrids() {
        ValidationOutcome outcome = validator.validate("{\"predictedOutput\": [[1, 2], [3]]}", expected(new int[][]{{1}}));

        assertFalse(outcome.isValid());
    }

    @Test
    void missingExpectedOutputIsNeverCorrect() {
        List<int[][]> expected = new ArrayList<>();
        expected.add(null);
        ValidationOutcome outcome = validator.validate("{\"predictedOutput\": [[1]]}", expected);

        assertTrue(outcome.isValid());
        assertEquals(List.of(false), outcome.getValidation().getCorrect());
    }

    @Test
    void readsExplanatoryFieldsFromAnswerObject() {
        String text = "{\"patternDescription\": \"Each colour maps to another\", \"solvingStrategy\": \"Lookup table\","
            + " \"hints\": [\"colours\", \"  \", 3], \"confidence\": 87.6, \"predictedOutput\": [[1]]}";

        ValidationOutcome outcome = validator.validate(text, expected(new int[][]{{1}}));

        AnswerDetails details = outcome.getAnswerDetails();
        assertEquals("Each colour maps to another", details.getPatternDescription());
        assertEquals("Lookup table", details.getSolvingStrategy());
        assertEquals(List.of("colours", "3"), details.getHints());
        assertEquals(88, details.getConfidence());
    }

    @Test
    void detailsStayWithTheObjectThatHoldsTheGrids() {
        String text = "Draft: {\"confidence\": 10}\nFinal: {\"confidence\": \"95%\", \"predictedOutput\": [[1]]}";

        ValidationOutcome outcome = validator.validate(text, expected(new int[][]{{1}}));

        assertEquals(95, outcome.getAnswerDetails().getConfidence());
        assertNull(outcome.getAnswerDetails().getPatternDescription());
    }

    @Test
    void countMismatchKeepsDetails() {
        ValidationOutcome outcome = validator.validate("{\"confidence\": 140, \"hints\": \"look at rows\"}",
            expected(new int[][]{{1}}));

        assertFalse(outcome.isValid());
        assertEquals(100, outcome.getAnswerDetails().getConfidence());
        assertEquals(List.of("look at rows"), outcome.getAnswerDetails().getHints());
    }

    @Test
    void confidenceIsNormalised() {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals(0, PredictionValidator.readConfidence(mapper.getNodeFactory().numberNode(-5)));
        assertEquals(100, PredictionValidator.readConfidence(mapper.getNodeFactory().booleanNode(true)));
        assertNull(PredictionValidator.readConfidence(mapper.getNodeFactory().textNode("high")));
        assertNull(PredictionValidator.readConfidence(null));
    }

    @Test
    void emptyAnswerIsCountMismatch() {
        ValidationOutcome outcome = validator.validate("", expected(new int[][]{{1}}));

        assertFalse(outcome.isValid());
        assertNotNull(outcome.getErrorDetail());
    }
}
