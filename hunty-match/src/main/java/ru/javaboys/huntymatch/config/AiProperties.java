package ru.javaboys.huntymatch.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class AiProperties {

    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);
    @Builder.Default
    String chatModel = "gpt-4o-mini";
    @Builder.Default
    double temperature = 0.3;
    @Builder.Default
    int maxTokens = 2000;
}
