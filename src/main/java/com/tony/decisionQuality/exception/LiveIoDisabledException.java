package com.tony.decisionQuality.exception;

/**
 * Levée quand une E/S live ou une écriture de snapshot est tentée sans le flag correspondant.
 * Jamais réessayée, jamais rétrogradée en warning.
 */
public class LiveIoDisabledException extends RuntimeException {

    public LiveIoDisabledException(String message) {
        super(message);
    }
}
