package ru.javaboys.huntymatch.ai;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;
import ru.javaboys.huntymatch.config.AiProperties;
import ru.javaboys.huntymatch.exception.InvalidInputException;
import ru.javaboys.huntymatch.exception.ServiceUnavailableException;
import ru.javaboys.huntymatch.service.EmbeddingProvider;
import ru.javaboys.huntymatch.util.ExternalCallGuard;

@Slf4j
@Component
@RequiredArgsConstructor
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final String SERVICE = "embedding-provider";

    private final EmbeddingModel embeddingModel;
    private final ExternalCallGuard externalCallGuard;
    private final AiProperties aiProperties;

    @Override
    public float[] embed(String text) {
        if (StringUtils.isBlank(text)) {
            throw new InvalidInputException("Cannot embed blank text");
        }
        float[] vec = externalCallGuard.call(SERVICE, aiProperties.getTimeout(), () -> embeddingModel.embed(text));
        if (vec == null || vec.length == 0) {
            throw new ServiceUnavailableException(SERVICE, "empty embedding");
        }
        log.debug("Embedded {} chars into {} dimensions", text.length(), vec.length);
        return vec;
    }
}
