package ru.javaboys.huntymatch.exception;

public class PersistenceFailureException extends MatchingException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
