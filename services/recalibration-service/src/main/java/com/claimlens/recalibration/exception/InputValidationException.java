package com.claimlens.recalibration.exception;

/**
 * Exception thrown when a weight table, weight vector or optimization config is invalid.
 * Always raised before any computation starts.
 */
public class InputValidationException extends RecalibrationException {
    
    public InputValidationException(String message) {
        super(message);
    }
    
    public InputValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
