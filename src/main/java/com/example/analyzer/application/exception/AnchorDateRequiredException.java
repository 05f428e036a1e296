package com.example.analyzer.application.exception;

/**
 * Thrown when the analysis window is requested without an anchor date.
 */
public class AnchorDateRequiredException extends UseCaseValidationException {

    public AnchorDateRequiredException() {
        super("An anchor date is required to compute the analysis window.");
    }
}
