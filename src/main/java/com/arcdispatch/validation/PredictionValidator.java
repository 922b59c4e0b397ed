package com.arcdispatch.validation;

import com.arcdispatch.models.AnswerDetails;
import com.arcdispatch.models.ExtractionMethod;
import com.arcdispatch.models.PredictionValidation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls predicted grids out of a model answer and scores them against the expected outputs.
 * A JSON answer object wins over grids scattered through free text.
 */
public class PredictionValidator {

    private static final Pattern CODE_FENCE = Pattern.compile("```[a-zA-Z0-9_-]*\\s*\\n?(.*?)```", Pattern.DOTALL);
    private static final String[] SINGLE_FIELDS = {"predictedOutput", "predicted_output_grid", "predicted_output"};
    private static final String[] DETAIL_FIELDS = {"patternDescription", "solvingStrategy", "hints", "confidence"};

    private final ObjectMapper objectMapper;

    public PredictionValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
    }

    /**
     * @param rawText  the model's final answer text
     * @param expected one expected grid per test case, in order; null entries are never correct
     */
    public ValidationOutcome validate(String rawText, List<int[][]> expected) {
        int testCount = expected.size();
        String text = rawText == null ? "" : rawText;
        List<JsonNode> candidates = jsonObjectCandidates(text);

        // grids and details come from the first object carrying a prediction field
        List<int[][]> grids = null;
        JsonNode answer = null;
        for (JsonNode candidate : candidates) {
            grids = readPredictionFields(candidate, testCount);
            if (grids != null) {
                answer = candidate;
                break;
            }
        }
        ExtractionMethod method = ExtractionMethod.DIRECT_FIELD;
        if (grids == null) {
            grids = recoverFromText(text, testCount);
            method = ExtractionMethod.TEXT_RECOVERY;
            answer = firstWithDetails(candidates);
        }
        AnswerDetails details = answer != null ? readDetails(answer) : null;
        if (testCount == 0 || grids.size() != testCount) {
            return ValidationOutcome.countMismatch(grids, testCount, details);
        }

        List<Boolean> correct = new ArrayList<>(testCount);
        for (int i = 0; i < testCount; i++) {
            correct.add(Grids.sameGrid(grids.get(i), expected.get(i)));
        }
        return ValidationOutcome.valid(new PredictionValidation(grids, correct, method), details);
    }

    private JsonNode firstWithDetails(List<JsonNode> candidates) {
        for (JsonNode candidate : candidates) {
            for (String field : DETAIL_FIELDS) {
                if (candidate.hasNonNull(field)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    /**
     * Explanatory fields of an answer object. Confidence is clamped to 0..100; hints keep at most
     * {@link AnswerDetails#MAX_HINTS} non-blank entries.
     */
    AnswerDetails readDetails(JsonNode answer) {
        return new AnswerDetails(
            textField(answer, "patternDescription"),
            textField(answer, "solvingStrategy"),
            readHints(answer.get("hints")),
            readConfidence(answer.get("confidence")));
    }

    private static String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }

    private static List<String> readHints(JsonNode value) {
        List<String> hints = new ArrayList<>();
        if (value == null || value.isNull()) {
            return hints;
        }
        if (value.isTextual()) {
            if (!value.asText().isBlank()) {
                hints.add(value.asText().trim());
            }
            return hints;
        }
        if (value.isArray()) {
            for (JsonNode item : value) {
                if (hints.size() == AnswerDetails.MAX_HINTS) {
                    break;
                }
                if (item.isValueNode() && !item.isNull() && !item.asText().isBlank()) {
                    hints.add(item.asText().trim());
                }
            }
        }
        return hints;
    }

    static Integer readConfidence(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean() ? 100 : 0;
        }
        double number;
        if (value.isNumber()) {
            number = value.asDouble();
        } else if (value.isTextual()) {
            String text = value.asText().trim().toLowerCase(Locale.ROOT).replace("%", "");
            try {
                number = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        if (Double.isNaN(number)) {
            return null;
        }
        return (int) Math.max(0, Math.min(100, Math.round(number)));
    }

    List<int[][]> readPredictionFields(JsonNode node, int testCount) {
        if (node == null || !node.isObject()) {
            return null;
        }
        if (testCount > 1 || !hasSingleField(node)) {
            List<int[][]> multi = readMultiFields(node);
            if (multi != null) {
                return multi;
            }
        }
        for (String field : SINGLE_FIELDS) {
            JsonNode value = node.get(field);
            if (value == null) {
                continue;
            }
            if (Grids.isValidGrid(value)) {
                List<int[][]> single = new ArrayList<>();
                single.add(Grids.toGrid(value));
                return single;
            }
            List<int[][]> nested = gridList(value);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    private List<int[][]> readMultiFields(JsonNode node) {
        List<int[][]> fromList = gridList(node.get("multiplePredictedOutputs"));
        if (fromList != null) {
            return fromList;
        }
        fromList = gridList(node.get("predictedOutputs"));
        if (fromList != null) {
            return fromList;
        }
        List<int[][]> numbered = new ArrayList<>();
        for (int i = 1; ; i++) {
            JsonNode value = node.get("predictedOutput" + i);
            if (value == null || !Grids.isValidGrid(value)) {
                break;
            }
            numbered.add(Grids.toGrid(value));
        }
        return numbered.isEmpty() ? null : numbered;
    }

    private boolean hasSingleField(JsonNode node) {
        for (String field : SINGLE_FIELDS) {
            if (node.has(field)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A JSON array whose every element is a valid grid, or null.
     */
    private List<int[][]> gridList(JsonNode value) {
        if (value == null || !value.isArray() || value.size() == 0) {
            return null;
        }
        List<int[][]> grids = new ArrayList<>();
        for (JsonNode item : value) {
            if (!Grids.isValidGrid(item)) {
                return null;
            }
            grids.add(Grids.toGrid(item));
        }
        return grids;
    }

    /**
     * Parsed JSON objects found in the text: the whole text, fenced blocks, then every balanced
     * top-level {...} span.
     */
    List<JsonNode> jsonObjectCandidates(String text) {
        List<JsonNode> candidates = new ArrayList<>();
        addIfObject(candidates, text.trim());
        Matcher fence = CODE_FENCE.matcher(text);
        while (fence.find()) {
            addIfObject(candidates, fence.group(1).trim());
        }
        for (String span : balancedSpans(text, '{', '}')) {
            addIfObject(candidates, span);
        }
        return candidates;
    }

    private void addIfObject(List<JsonNode> candidates, String json) {
        if (json.isEmpty() || json.charAt(0) != '{') {
            return;
        }
        JsonNode node = tryParse(json);
        if (node != null && node.isObject()) {
            candidates.add(node);
        }
    }

    private JsonNode tryParse(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            return null;
        }
    }

    /**
     * Last {@code testCount} grid-shaped arrays in the text. Arrays of grids count as their members.
     */
    List<int[][]> recoverFromText(String text, int testCount) {
        List<int[][]> found = new ArrayList<>();
        for (String span : gridSpans(text)) {
            JsonNode node = tryParse(span);
            if (node == null) {
                continue;
            }
            if (Grids.isValidGrid(node)) {
                found.add(Grids.toGrid(node));
                continue;
            }
            List<int[][]> nested = gridList(node);
            if (nested != null) {
                found.addAll(nested);
            }
        }
        if (found.size() <= testCount) {
            return found;
        }
        return new ArrayList<>(found.subList(found.size() - testCount, found.size()));
    }

    /**
     * Balanced [...] spans that open with "[[" (ignoring whitespace), outermost only.
     */
    private List<String> gridSpans(String text) {
        List<String> spans = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) == '[' && nextNonSpace(text, i + 1) == '[') {
                int end = matchingClose(text, i, '[', ']');
                if (end > 0) {
                    spans.add(text.substring(i, end + 1));
                    i = end + 1;
                    continue;
                }
            }
            i++;
        }
        return spans;
    }

    private List<String> balancedSpans(String text, char open, char close) {
        List<String> spans = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) == open) {
                int end = matchingClose(text, i, open, close);
                if (end > 0) {
                    spans.add(text.substring(i, end + 1));
                    i = end + 1;
                    continue;
                }
            }
            i++;
        }
        return spans;
    }

    /**
     * Index of the bracket closing the one at {@code start}, skipping JSON strings; -1 if unbalanced.
     */
    private static int matchingClose(String text, int start, char open, char close) {
        int depth = 0;
        boolean inString = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static char nextNonSpace(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c;
            }
        }
        return 0;
    }
}
