package com.singkhmer.controller;

import java.util.List;

public class SearchResponse {
    private final String input;
    private final String mode;
    private final List<String> results;

    public SearchResponse(String input, String mode, List<String> results) {
        this.input = input == null ? "" : input;
        this.mode = mode;
        this.results = results;
    }

    public String getInput() { return input; }
    public String getMode() { return mode; }
    public List<String> getResults() { return results; }
}
