package ru.javaboys.huntymatch.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class VectorizationProperties {

    @Builder.Default
    int batchSize = 10;
    @Builder.Default
    Duration batchDelay = Duration.ofSeconds(1);
    @Builder.Default
    int upsertChunkSize = 100;
}
