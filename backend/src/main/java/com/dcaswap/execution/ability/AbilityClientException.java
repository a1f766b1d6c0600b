package com.dcaswap.execution.ability;

/**
 * The execution service could not be reached or answered without a readable response envelope.
 */
public class AbilityClientException extends RuntimeException {

    public AbilityClientException(String message) {
        super(message);
    }

    public AbilityClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
