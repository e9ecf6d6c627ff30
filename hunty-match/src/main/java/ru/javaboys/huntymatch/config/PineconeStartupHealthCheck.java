package ru.javaboys.huntymatch.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import ru.javaboys.huntymatch.dto.IndexStats;
import ru.javaboys.huntymatch.service.VectorIndex;

/**
 * Logs vector index availability once the application is up. An unreachable index does not
 * stop startup: matching falls back to in-process scoring.
 */
@Slf4j
@Component
public class PineconeStartupHealthCheck {

    private final VectorIndex vectorIndex;

    public PineconeStartupHealthCheck(VectorIndex vectorIndex) {
        this.vectorIndex = vectorIndex;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void verifyIndexAvailability() {
        try {
            IndexStats stats = vectorIndex.stats();
            log.info("Vector index is reachable: {} vectors, dimension {}", stats.count(), stats.dimension());
        } catch (Exception e) {
            log.warn("Vector index is not reachable, matching will use the in-process fallback until it is: {}",
                    e.getMessage());
        }
    }
}
