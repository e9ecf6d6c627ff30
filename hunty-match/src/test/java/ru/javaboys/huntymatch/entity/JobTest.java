package ru.javaboys.huntymatch.entity;

import org.junit.jupiter.api.Test;
import ru.javaboys.huntymatch.exception.InvalidInputException;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobTest {

    private static Job.JobBuilder valid() {
        return Job.builder()
                .id(1)
                .title("Engineer")
                .company("Acme")
                .location("NYC")
                .industry("Tech")
                .experienceLevel(ExperienceLevelEnum.MID);
    }

    @Test
    void appliesDefaults() {
        Job job = valid().skills(Arrays.asList("java", null)).build();

        assertThat(job.getWorkType()).isEqualTo(WorkTypeEnum.FULL_TIME);
        assertThat(job.getSkills()).containsExactly("java");
        assertThat(job.getDescription()).isEmpty();
        assertThat(job.hasEmbedding()).isFalse();
    }

    @Test
    void requiresCoreFields() {
        assertThatThrownBy(() -> valid().title(" ").build()).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> valid().company(null).build()).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> valid().experienceLevel(null).build()).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void rejectsInvertedSalaryRange() {
        assertThatThrownBy(() -> valid().salaryMin(100).salaryMax(50).build())
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void rejectsEmptyEmbedding() {
        Job job = valid().build();

        assertThatThrownBy(() -> job.attachEmbedding(new float[0])).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void negativeExperienceYearsAreRejected() {
        assertThatThrownBy(() -> ResumeProfile.builder().yearsOfExperience(-1).build())
                .isInstanceOf(InvalidInputException.class);
        assertThat(ResumeProfile.builder().build().getExperienceLevel()).isEqualTo(ExperienceLevelEnum.ENTRY);
    }
}
