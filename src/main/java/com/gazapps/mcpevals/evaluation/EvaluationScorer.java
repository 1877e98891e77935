package com.gazapps.mcpevals.evaluation;

import com.gazapps.mcpevals.core.CancellationToken;
import com.gazapps.mcpevals.model.EvaluationScore;

/**
 * Judges the quality of a response to a prompt.
 */
public interface EvaluationScorer {

    /**
     * @param expectedResult optional reference answer, may be {@code null}
     * @return the score; a judge that cannot be reached or read gives a neutral score
     */
    EvaluationScore score(String prompt, String response, String expectedResult, CancellationToken cancellation);
}
