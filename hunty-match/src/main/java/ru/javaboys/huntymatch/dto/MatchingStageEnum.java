package ru.javaboys.huntymatch.dto;

/**
 * Stages of one matching request. FAILED can follow any stage and sends the request down the fallback path.
 */
public enum MatchingStageEnum {
    IDLE,
    RETRIEVING,
    SCORING,
    DIVERSIFYING,
    FILTERING,
    PERSISTING,
    DONE,
    FAILED
}
