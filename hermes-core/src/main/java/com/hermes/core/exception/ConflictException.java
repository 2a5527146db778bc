package com.hermes.core.exception;

/**
 * Thrown when storage rejects a write because of a uniqueness or
 * referential-integrity constraint. The message is the storage layer's own.
 */
public class ConflictException extends HermesException {
    
    public static final String ERROR_CODE = "CONFLICT";
    
    public ConflictException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
