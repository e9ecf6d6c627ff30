package ru.javaboys.huntymatch.ai.dto;

import lombok.Data;

import java.util.List;

@Data
public class AppropriatenessReviewDto {
    private List<JobDecisionDto> analysis;
    private String summary;   // overall market fit, logged only

    @Data
    public static class JobDecisionDto {
        private Integer jobId;                 // position in the reviewed list
        private String decision;               // KEEP | FILTER_OUT
        private String reason;
        private String confidenceAdjustment;   // INCREASE | DECREASE | NONE
    }
}
