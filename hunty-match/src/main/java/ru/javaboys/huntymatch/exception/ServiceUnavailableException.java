package ru.javaboys.huntymatch.exception;

import lombok.Getter;

/**
 * Embedding provider, vector index or reasoning service did not answer in a usable way.
 * Callers switch to their fallback path instead of surfacing it.
 */
@Getter
public class ServiceUnavailableException extends MatchingException {

    private final String service;

    public ServiceUnavailableException(String service, String message) {
        super(service + ": " + message);
        this.service = service;
    }

    public ServiceUnavailableException(String service, String message, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
    }
}
