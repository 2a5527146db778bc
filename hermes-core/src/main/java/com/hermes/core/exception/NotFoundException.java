package com.hermes.core.exception;

/**
 * Thrown when a host, event type or event is not found.
 */
public class NotFoundException extends HermesException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, Object key) {
        super(ERROR_CODE, String.format(
            "No such %s %s found",
            entityType, key
        ));
    }
}
