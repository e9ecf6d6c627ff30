package ru.javaboys.huntymatch.exception;

/**
 * Base type for everything the matching pipeline throws.
 */
public class MatchingException extends RuntimeException {

    public MatchingException(String message) {
        super(message);
    }

    public MatchingException(String message, Throwable cause) {
        super(message, cause);
    }
}
