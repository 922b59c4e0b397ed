package com.arcdispatch.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Puzzle {

    private String id;
    private List<PuzzleExample> train = new ArrayList<>();
    private List<PuzzleExample> test = new ArrayList<>();

    public Puzzle() {
    }

    public Puzzle(String id, List<PuzzleExample> train, List<PuzzleExample> test) {
        this.id = id;
        this.train = train != null ? train : new ArrayList<>();
        this.test = test != null ? test : new ArrayList<>();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public List<PuzzleExample> getTrain() {
        return train;
    }

    public void setTrain(List<PuzzleExample> train) {
        this.train = train != null ? train : new ArrayList<>();
    }

    public List<PuzzleExample> getTest() {
        return test;
    }

    public void setTest(List<PuzzleExample> test) {
        this.test = test != null ? test : new ArrayList<>();
    }

    @JsonIgnore
    public int getTestCount() {
        return test.size();
    }

    /**
     * Expected outputs of the test cases in order. Entries are null where the catalog has no answer.
     */
    @JsonIgnore
    public List<int[][]> getExpectedOutputs() {
        List<int[][]> expected = new ArrayList<>(test.size());
        for (PuzzleExample example : test) {
            expected.add(example.getOutput());
        }
        return expected;
    }
}
