package ru.javaboys.huntymatch.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.javaboys.huntymatch.ai.LlmAppropriatenessFilter;
import ru.javaboys.huntymatch.ai.OpenAiService;
import ru.javaboys.huntymatch.scoring.ScoringConfig;
import ru.javaboys.huntymatch.service.AppropriatenessFilter;
import ru.javaboys.huntymatch.service.impl.KeepAllAppropriatenessFilter;
import ru.javaboys.huntymatch.util.ExternalCallGuard;

import java.time.Duration;

@Slf4j
@Configuration
public class MatchingConfig {

    @Bean
    public ScoringConfig scoringConfig(
            @Value("${hunty.scoring.vector-weight:0.5}") double vectorWeight,
            @Value("${hunty.scoring.skill-weight:0.3}") double skillWeight,
            @Value("${hunty.scoring.experience-weight:0.2}") double experienceWeight,
            @Value("${hunty.scoring.fallback-skill-weight:0.7}") double fallbackSkillWeight,
            @Value("${hunty.scoring.fallback-experience-weight:0.3}") double fallbackExperienceWeight
    ) {
        return ScoringConfig.builder()
                .vectorWeight(vectorWeight)
                .skillWeight(skillWeight)
                .experienceWeight(experienceWeight)
                .fallbackSkillWeight(fallbackSkillWeight)
                .fallbackExperienceWeight(fallbackExperienceWeight)
                .build();
    }

    @Bean
    public MatchingProperties matchingProperties(
            @Value("${hunty.matching.mmr-lambda:0.7}") double mmrLambda,
            @Value("${hunty.matching.over-fetch-factor:2.5}") double overFetchFactor,
            @Value("${hunty.matching.min-over-fetch:50}") int minOverFetch,
            @Value("${hunty.matching.max-filter-pool:30}") int maxFilterPool,
            @Value("${hunty.matching.min-vector-score:0.0}") double minVectorScore
    ) {
        return MatchingProperties.builder()
                .mmrLambda(mmrLambda)
                .overFetchFactor(overFetchFactor)
                .minOverFetch(minOverFetch)
                .maxFilterPool(maxFilterPool)
                .minVectorScore(minVectorScore)
                .build();
    }

    @Bean
    public AiProperties aiProperties(
            @Value("${hunty.ai.timeout-seconds:30}") long timeoutSeconds,
            @Value("${hunty.ai.chat-model:gpt-4o-mini}") String chatModel,
            @Value("${hunty.ai.temperature:0.3}") double temperature,
            @Value("${hunty.ai.max-tokens:2000}") int maxTokens
    ) {
        return AiProperties.builder()
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .chatModel(chatModel)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
    }

    @Bean
    public VectorizationProperties vectorizationProperties(
            @Value("${hunty.vectorization.batch-size:10}") int batchSize,
            @Value("${hunty.vectorization.batch-delay-ms:1000}") long batchDelayMs
    ) {
        return VectorizationProperties.builder()
                .batchSize(Math.max(1, batchSize))
                .batchDelay(Duration.ofMillis(Math.max(0, batchDelayMs)))
                .build();
    }

    @Bean
    public ExternalCallGuard externalCallGuard(
            @Value("${hunty.ai.max-concurrent-calls:16}") int maxConcurrentCalls
    ) {
        return new ExternalCallGuard(maxConcurrentCalls);
    }

    @Bean
    public ChatClient chatClient(ChatClient.Builder builder) {
        return builder.build();
    }

    @Bean
    public AppropriatenessFilter appropriatenessFilter(
            OpenAiService openAiService,
            @Value("${hunty.matching.ai-filter.enabled:true}") boolean aiFilterEnabled
    ) {
        if (!aiFilterEnabled) {
            log.info("AI appropriateness filter disabled, all candidates will be kept");
            return new KeepAllAppropriatenessFilter();
        }
        return new LlmAppropriatenessFilter(openAiService);
    }
}
