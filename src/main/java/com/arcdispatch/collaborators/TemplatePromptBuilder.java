package com.arcdispatch.collaborators;

import com.arcdispatch.models.AnalysisConfig;
import com.arcdispatch.models.Puzzle;
import com.arcdispatch.models.PuzzleExample;
import com.arcdispatch.validation.Grids;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in prompt templates. A custom instruction replaces the template's task text; puzzle
 * data and the answer format are always rendered the same way.
 */
public class TemplatePromptBuilder implements PromptBuilder {

    public static final String SOLVER = "solver";
    public static final String EXPLANATION = "explanation";
    public static final String ALIEN_COMMUNICATION = "alienCommunication";

    private static final String SYSTEM_ROLE =
        "You are an expert at abstract reasoning puzzles. Each puzzle shows grids of integers 0-9 "
            + "where every integer is a color. Infer the transformation that maps each training input "
            + "to its output and apply it to the test input(s).";

    private final Map<String, Template> templates = new LinkedHashMap<>();

    public TemplatePromptBuilder() {
        templates.put(SOLVER, new Template(true,
            "Study the training examples, work out the transformation rule, and predict the output grid "
                + "for every test input. Give exact grids; dimensions matter."));
        templates.put(EXPLANATION, new Template(false,
            "Explain the transformation rule that maps each input to its output: what changes, what stays, "
                + "and why. Then state the output grid for every test input."));
        templates.put(ALIEN_COMMUNICATION, new Template(false,
            "These grids are messages from an alien civilization that communicates through colored symbols. "
                + "Decode what each transformation is trying to say, describe the message in plain words, "
                + "and give the reply grid for every test input."));
    }

    public List<String> getTemplateIds() {
        return List.copyOf(templates.keySet());
    }

    @Override
    public BuiltPrompt build(Puzzle puzzle, AnalysisConfig config) {
        String templateId = config.getEffectiveTemplateId();
        String task;
        boolean solverMode;
        if (templateId == null) {
            task = config.getCustomInstruction();
            solverMode = true;
        } else {
            Template template = templates.get(templateId);
            if (template == null) {
                throw new IllegalArgumentException("Unknown prompt template: " + templateId);
            }
            task = template.task;
            solverMode = template.solver;
        }
        boolean showAnswers = !solverMode && !config.isOmitGroundTruth();

        StringBuilder user = new StringBuilder();
        user.append("TRAINING EXAMPLES\n");
        List<PuzzleExample> train = puzzle.getTrain();
        for (int i = 0; i < train.size(); i++) {
            user.append("\nExample ").append(i + 1).append(" input:\n").append(Grids.format(train.get(i).getInput()));
            user.append("\nExample ").append(i + 1).append(" output:\n").append(Grids.format(train.get(i).getOutput()));
            user.append('\n');
        }

        user.append("\nTEST\n");
        List<PuzzleExample> tests = puzzle.getTest();
        for (int i = 0; i < tests.size(); i++) {
            String label = tests.size() == 1 ? "Test" : "Test " + (i + 1);
            user.append('\n').append(label).append(" input:\n").append(Grids.format(tests.get(i).getInput()));
            if (showAnswers && tests.get(i).getOutput() != null) {
                user.append('\n').append(label).append(" correct output:\n").append(Grids.format(tests.get(i).getOutput()));
            }
            user.append('\n');
        }

        user.append("\nTASK\n").append(task).append('\n');
        user.append("\nANSWER FORMAT\n").append(answerFormat(tests.size()));
        return new BuiltPrompt(SYSTEM_ROLE, user.toString(), templateId);
    }

    static String answerFormat(int testCount) {
        StringBuilder sb = new StringBuilder();
        sb.append("Reply with one JSON object containing \"patternDescription\", \"solvingStrategy\", ")
            .append("\"hints\" (list of strings), \"confidence\" (integer 0-100) and ");
        if (testCount <= 1) {
            sb.append("\"predictedOutput\": the output grid as a list of rows of integers.");
        } else {
            sb.append("\"multiplePredictedOutputs\": true plus ");
            for (int i = 1; i <= testCount; i++) {
                if (i > 1) {
                    sb.append(i == testCount ? " and " : ", ");
                }
                sb.append("\"predictedOutput").append(i).append('"');
            }
            sb.append(", one grid per test input in order.");
        }
        return sb.append('\n').toString();
    }

    private static final class Template {
        final boolean solver;
        final String task;

        Template(boolean solver, String task) {
            this.solver = solver;
            this.task = task;
        }
    }
}
