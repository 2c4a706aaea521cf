package com.nosota.roundup.error;

/**
 * The bank data aggregator rejected a call or could not be reached.
 */
public class AggregatorException extends Exception {
    public AggregatorException(String message) {
        super(message);
    }

    public AggregatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
