package com.gazapps.mcpevals.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One prompt of a suite. Instances are matched to their results by identity.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EvaluationRequest {

    public String name;
    public String description;
    public String prompt;
    @JsonAlias("expected_result")
    public String expectedResult;

    public EvaluationRequest() {
    }

    public EvaluationRequest(String name, String description, String prompt) {
        this(name, description, prompt, null);
    }

    public EvaluationRequest(String name, String description, String prompt, String expectedResult) {
        this.name = name;
        this.description = description;
        this.prompt = prompt;
        this.expectedResult = expectedResult;
    }

    @Override
    public String toString() {
        return "EvaluationRequest{name='" + name + "'}";
    }
}
