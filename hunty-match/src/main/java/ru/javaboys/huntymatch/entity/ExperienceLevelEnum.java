package ru.javaboys.huntymatch.entity;

import org.springframework.lang.Nullable;

import java.util.Locale;

/**
 * Ordered experience tiers. Ordinal position is used for distance computation,
 * so declaration order must stay ENTRY &lt; MID &lt; SENIOR &lt; LEADERSHIP.
 */
public enum ExperienceLevelEnum {

    ENTRY("Entry Level", "entry"),
    MID("Mid-Level", "mid"),
    SENIOR("Senior Level", "senior"),
    LEADERSHIP("Leadership", "leadership");

    private final String id;
    private final String shortName;

    ExperienceLevelEnum(String id, String shortName) {
        this.id = id;
        this.shortName = shortName;
    }

    public String getId() {
        return id;
    }

    @Nullable
    public static ExperienceLevelEnum fromId(@Nullable String id) {
        if (id == null) {
            return null;
        }
        String t = id.trim();
        for (ExperienceLevelEnum at : ExperienceLevelEnum.values()) {
            if (at.getId().equalsIgnoreCase(t)
                    || at.name().equalsIgnoreCase(t)
                    || at.shortName.equals(t.toLowerCase(Locale.ROOT))) {
                return at;
            }
        }
        return null;
    }
}
