package ru.javaboys.huntymatch.entity;

import org.springframework.lang.Nullable;

public enum ConfidenceLevelEnum {

    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String id;

    ConfidenceLevelEnum(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public ConfidenceLevelEnum increase() {
        return this == LOW ? MEDIUM : HIGH;
    }

    public ConfidenceLevelEnum decrease() {
        return this == HIGH ? MEDIUM : LOW;
    }

    @Nullable
    public static ConfidenceLevelEnum fromId(String id) {
        for (ConfidenceLevelEnum at : ConfidenceLevelEnum.values()) {
            if (at.getId().equals(id)) {
                return at;
            }
        }
        return null;
    }
}
