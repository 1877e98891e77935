package com.gazapps.mcpevals.llm;

import com.gazapps.mcpevals.core.CancellationToken;

/**
 * Contract every language model provider implements. Used for tool planning and for scoring.
 */
public interface LanguageModel {

    /**
     * Sends the request and returns the text of the first completion.
     *
     * @throws LlmException when the provider call fails
     * @throws java.util.concurrent.CancellationException when the run is cancelled mid-call
     */
    String generate(LlmRequest request, CancellationToken cancellation);

    LlmProvider getProvider();

    String getModelName();
}
