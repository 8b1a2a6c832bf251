package com.example.xagent.exception;

/**
 * A domain definition could not be read, parsed or validated.
 */
public class HandlerLoadException extends RuntimeException {

    private final String domainName;

    public HandlerLoadException(String domainName, String message) {
        super(message);
        this.domainName = domainName;
    }

    public HandlerLoadException(String domainName, String message, Throwable cause) {
        super(message, cause);
        this.domainName = domainName;
    }

    public String getDomainName() {
        return domainName;
    }
}
