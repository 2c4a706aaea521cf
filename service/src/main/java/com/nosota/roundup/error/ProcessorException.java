package com.nosota.roundup.error;

import lombok.Getter;

/**
 * The payment processor rejected a request or could not be reached.
 *
 * <p>{@code outcomeUnknown} is true when no definitive answer arrived (timeout, exhausted retries):
 * the charge may or may not exist, so it must be resolved by reconciliation, never re-requested.
 */
@Getter
public class ProcessorException extends Exception {

    private final boolean outcomeUnknown;

    public ProcessorException(String message, boolean outcomeUnknown) {
        super(message);
        this.outcomeUnknown = outcomeUnknown;
    }

    public ProcessorException(String message, boolean outcomeUnknown, Throwable cause) {
        super(message, cause);
        this.outcomeUnknown = outcomeUnknown;
    }
}
