package com.williamcallahan.wikimark.service.math;

/**
 * Signals that the math rendering backend is not on the classpath.
 *
 * <p>This is a deployment problem, not a defect in the document being converted: adding
 * the backend and restarting fixes it. Math fences still convert to passthrough markup
 * while it is missing.</p>
 */
public class MathRenderingUnavailableException extends MathRenderingException {

    public MathRenderingUnavailableException(String message) {
        super(message);
    }
}
