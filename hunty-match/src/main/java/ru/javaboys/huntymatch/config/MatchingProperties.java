package ru.javaboys.huntymatch.config;

import lombok.Builder;
import lombok.Value;

/**
 * Pipeline knobs outside the composite score itself.
 */
@Value
@Builder(toBuilder = true)
public class MatchingProperties {

    @Builder.Default
    double mmrLambda = 0.7;
    @Builder.Default
    double overFetchFactor = 2.5;
    @Builder.Default
    int minOverFetch = 50;
    @Builder.Default
    int filterPoolMultiplier = 3;
    @Builder.Default
    int maxFilterPool = 30;
    @Builder.Default
    double minVectorScore = 0.0;

    public static MatchingProperties defaults() {
        return MatchingProperties.builder().build();
    }

    /**
     * How many diversified candidates go to the appropriateness filter for a request of {@code limit}.
     */
    public int filterPoolSize(int limit) {
        return Math.max(limit, Math.min(limit * filterPoolMultiplier, maxFilterPool));
    }

    /**
     * How many hits to ask the index for when {@code finalResults} survive diversification.
     */
    public int overFetch(int finalResults) {
        return Math.max((int) Math.ceil(finalResults * overFetchFactor), minOverFetch);
    }
}
