package com.gazapps.mcpevals.exceptions;

/**
 * The language model could not produce a usable tool plan.
 */
public class PlanningException extends McpEvalsException {

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
