package com.williamcallahan.wikimark.service.math;

/**
 * Signals that an expression could not be rendered, e.g. because it does not parse.
 */
public class MathRenderingException extends RuntimeException {

    public MathRenderingException(String message) {
        super(message);
    }

    public MathRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
