package ru.javaboys.huntymatch.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.dto.VectorizationReport;
import ru.javaboys.huntymatch.service.impl.JobVectorizationService;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "hunty.vectorization.scheduled", havingValue = "true")
public class JobVectorizationJob {

    private final JobVectorizationService vectorizationService;

    @Scheduled(fixedDelayString = "${hunty.vectorization.fixed-delay-ms:300000}",
            initialDelayString = "${hunty.vectorization.initial-delay-ms:10000}")
    public void vectorizeMissing() {
        try {
            VectorizationReport report = vectorizationService.vectorizeMissing();
            if (report.processed() > 0) {
                log.info("Scheduled vectorization: {}", report);
            }
        } catch (Exception e) {
            log.warn("Scheduled vectorization failed: {}", e.getMessage(), e);
        }
    }
}
