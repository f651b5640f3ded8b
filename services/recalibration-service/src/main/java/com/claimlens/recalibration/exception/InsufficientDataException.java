package com.claimlens.recalibration.exception;

/**
 * Exception for empty claim sets passed to the evaluator, runner or optimizer
 */
public class InsufficientDataException extends RecalibrationException {
    
    public InsufficientDataException(String message) {
        super(message);
    }
    
    public InsufficientDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
