package com.jay.cryptoagent.reasoning;

/** Transport failure or non-2xx reply from the reasoning service. */
public class ReasoningException extends RuntimeException {

    public ReasoningException(String message) {
        super(message);
    }

    public ReasoningException(String message, Throwable cause) {
        super(message, cause);
    }
}
