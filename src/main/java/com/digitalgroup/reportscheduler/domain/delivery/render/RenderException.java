package com.digitalgroup.reportscheduler.domain.delivery.render;

/**
 * Renderer failure; retryable under the schedule's retry policy.
 */
public class RenderException extends Exception {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
