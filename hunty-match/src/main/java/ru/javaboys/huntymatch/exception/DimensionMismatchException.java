package ru.javaboys.huntymatch.exception;

import lombok.Getter;

@Getter
public class DimensionMismatchException extends MatchingException {

    private final int left;
    private final int right;

    public DimensionMismatchException(int left, int right) {
        super("Vectors must have the same length: " + left + " != " + right);
        this.left = left;
        this.right = right;
    }
}
