package ru.javaboys.huntymatch.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class MatchingOptions {
    int limit;
    @Builder.Default
    List<String> industryFilter = List.of();
    @Builder.Default
    boolean diversify = true;

    public static MatchingOptions ofLimit(int limit) {
        return MatchingOptions.builder().limit(limit).build();
    }
}
