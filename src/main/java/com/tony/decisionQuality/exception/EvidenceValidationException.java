package com.tony.decisionQuality.exception;

public class EvidenceValidationException extends RuntimeException {

    public EvidenceValidationException(String message) {
        super(message);
    }
}
