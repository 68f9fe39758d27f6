package com.tony.decisionQuality.exception;

/**
 * Fichier de politique illisible ou hors bornes.
 */
public class PolicyValidationException extends RuntimeException {

    public PolicyValidationException(String message) {
        super(message);
    }

    public PolicyValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
