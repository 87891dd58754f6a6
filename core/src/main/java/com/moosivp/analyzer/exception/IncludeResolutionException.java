package com.moosivp.analyzer.exception;

/**
 * Thrown by an include resolver that failed to read an existing target.
 */
public class IncludeResolutionException extends Exception {

    public IncludeResolutionException(String message) {
        super(message);
    }

    public IncludeResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
