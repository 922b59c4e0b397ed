package com.arcdispatch.providers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Strict JSON-schema response formats for structured answers, shaped by the puzzle's test count.
 */
public final class ResponseSchemas {

    public static final String SCHEMA_NAME = "arc_analysis";

    private ResponseSchemas() {
    }

    /**
     * The {@code text.format} object of a Responses API request.
     */
    public static ObjectNode responseFormat(ObjectMapper mapper, int testCount) {
        ObjectNode format = mapper.createObjectNode();
        format.put("type", "json_schema");
        format.put("name", SCHEMA_NAME);
        format.put("strict", true);
        format.set("schema", answerSchema(mapper, testCount));
        return format;
    }

    public static ObjectNode answerSchema(ObjectMapper mapper, int testCount) {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = schema.putArray("required");

        if (testCount <= 1) {
            properties.set("predictedOutput", gridSchema(mapper, "Predicted output grid for the test input"));
            required.add("predictedOutput");
        } else {
            ObjectNode flag = properties.putObject("multiplePredictedOutputs");
            flag.put("type", "boolean");
            flag.put("description", "Always true: one grid per test case in predictedOutput1..N");
            required.add("multiplePredictedOutputs");
            for (int i = 1; i <= testCount; i++) {
                properties.set("predictedOutput" + i, gridSchema(mapper, "Predicted output grid for test case " + i));
                required.add("predictedOutput" + i);
            }
        }

        stringProperty(properties, required, "patternDescription", "The transformation rule in plain words");
        stringProperty(properties, required, "solvingStrategy", "How the rule was derived from the training pairs");
        ObjectNode hints = properties.putObject("hints");
        hints.put("type", "array");
        hints.putObject("items").put("type", "string");
        required.add("hints");
        ObjectNode confidence = properties.putObject("confidence");
        confidence.put("type", "integer");
        confidence.put("description", "Certainty in the prediction, 0 to 100");
        required.add("confidence");

        schema.put("additionalProperties", false);
        return schema;
    }

    private static ObjectNode gridSchema(ObjectMapper mapper, String description) {
        ObjectNode grid = mapper.createObjectNode();
        grid.put("type", "array");
        grid.put("description", description);
        ObjectNode row = grid.putObject("items");
        row.put("type", "array");
        row.putObject("items").put("type", "integer");
        return grid;
    }

    private static void stringProperty(ObjectNode properties, ArrayNode required, String name, String description) {
        ObjectNode node = properties.putObject(name);
        node.put("type", "string");
        node.put("description", description);
        required.add(name);
    }
}
