package com.gazapps.mcpevals.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A complete suite as read from a YAML or JSON file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EvaluationConfiguration {

    public String name;
    public String description;
    public ModelConfiguration model;
    public ServerConfiguration server;
    @JsonAlias("evaluations")
    public List<EvaluationRequest> evals = new ArrayList<>();

    public EvaluationConfiguration() {
    }

    public EvaluationConfiguration(ModelConfiguration model, ServerConfiguration server, List<EvaluationRequest> evals) {
        this.model = model;
        this.server = server;
        this.evals = evals;
    }
}
