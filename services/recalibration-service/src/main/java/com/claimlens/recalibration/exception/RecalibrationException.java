package com.claimlens.recalibration.exception;

/**
 * Base exception for recalibration and weight optimization errors
 */
public class RecalibrationException extends RuntimeException {
    
    public RecalibrationException(String message) {
        super(message);
    }
    
    public RecalibrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
