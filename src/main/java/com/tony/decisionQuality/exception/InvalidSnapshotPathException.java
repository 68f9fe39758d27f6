package com.tony.decisionQuality.exception;

public class InvalidSnapshotPathException extends IllegalArgumentException {

    public InvalidSnapshotPathException(String message) {
        super(message);
    }
}
