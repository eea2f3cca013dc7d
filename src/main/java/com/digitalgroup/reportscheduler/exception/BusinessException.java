package com.digitalgroup.reportscheduler.exception;

/**
 * Rule violation the caller can act on (409)
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
