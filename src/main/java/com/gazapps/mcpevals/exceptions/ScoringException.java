package com.gazapps.mcpevals.exceptions;

/**
 * The scoring language model call itself failed. Unparseable scores are not
 * reported this way; they fall back to a neutral score.
 */
public class ScoringException extends McpEvalsException {

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
