package com.hermes.core.exception;

/**
 * Base exception for all Hermes errors.
 */
public class HermesException extends RuntimeException {
    
    private final String errorCode;
    
    public HermesException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public HermesException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
