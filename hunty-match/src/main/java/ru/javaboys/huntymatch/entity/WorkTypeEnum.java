package ru.javaboys.huntymatch.entity;

import org.springframework.lang.Nullable;

public enum WorkTypeEnum {

    FULL_TIME("Full-time"),
    PART_TIME("Part-time"),
    CONTRACT("Contract"),
    REMOTE("Remote");

    private final String id;

    WorkTypeEnum(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    @Nullable
    public static WorkTypeEnum fromId(String id) {
        for (WorkTypeEnum at : WorkTypeEnum.values()) {
            if (at.getId().equalsIgnoreCase(id)) {
                return at;
            }
        }
        return null;
    }
}
