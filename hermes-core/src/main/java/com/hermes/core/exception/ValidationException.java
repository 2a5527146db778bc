package com.hermes.core.exception;

/**
 * Thrown when a required argument is missing or malformed.
 */
public class ValidationException extends HermesException {
    
    public static final String ERROR_CODE = "VALIDATION_FAILED";
    
    public ValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public static ValidationException missingArgument(String argument) {
        return new ValidationException("Missing Required Argument: " + argument);
    }

    public static ValidationException invalidArgument(String argument, String value) {
        return new ValidationException(String.format(
            "Invalid argument %s: %s",
            argument, value
        ));
    }
}
