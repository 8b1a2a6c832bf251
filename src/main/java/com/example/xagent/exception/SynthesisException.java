package com.example.xagent.exception;

/**
 * A plugin synthesizer failed to produce a usable handler definition.
 */
public class SynthesisException extends RuntimeException {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
