package ru.javaboys.huntymatch.exception;

/**
 * Malformed job or résumé data. Not retried, surfaced to the caller.
 */
public class InvalidInputException extends MatchingException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
