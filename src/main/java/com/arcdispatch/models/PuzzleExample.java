package com.arcdispatch.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One input/output pair of an ARC task. The output of a test example may be absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PuzzleExample {

    private int[][] input;
    private int[][] output;

    public PuzzleExample() {
    }

    public PuzzleExample(int[][] input, int[][] output) {
        this.input = input;
        this.output = output;
    }

    public int[][] getInput() {
        return input;
    }

    public void setInput(int[][] input) {
        this.input = input;
    }

    public int[][] getOutput() {
        return output;
    }

    public void setOutput(int[][] output) {
        this.output = output;
    }
}
