package ru.javaboys.huntymatch.entity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExperienceLevelEnumTest {

    @Test
    void resolvesLabelsNamesAndShortNames() {
        assertThat(ExperienceLevelEnum.fromId("Mid-Level")).isEqualTo(ExperienceLevelEnum.MID);
        assertThat(ExperienceLevelEnum.fromId("senior level")).isEqualTo(ExperienceLevelEnum.SENIOR);
        assertThat(ExperienceLevelEnum.fromId("LEADERSHIP")).isEqualTo(ExperienceLevelEnum.LEADERSHIP);
        assertThat(ExperienceLevelEnum.fromId(" entry ")).isEqualTo(ExperienceLevelEnum.ENTRY);
    }

    @Test
    void unknownLevelIsNull() {
        assertThat(ExperienceLevelEnum.fromId("Principal Wizard")).isNull();
        assertThat(ExperienceLevelEnum.fromId(null)).isNull();
    }

    @Test
    void tiersAreOrdered() {
        assertThat(ExperienceLevelEnum.values()).containsExactly(
                ExperienceLevelEnum.ENTRY, ExperienceLevelEnum.MID, ExperienceLevelEnum.SENIOR, ExperienceLevelEnum.LEADERSHIP);
    }
}
