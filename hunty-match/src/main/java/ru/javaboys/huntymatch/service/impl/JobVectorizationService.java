package ru.javaboys.huntymatch.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.config.VectorizationProperties;
import ru.javaboys.huntymatch.dto.IndexStats;
import ru.javaboys.huntymatch.dto.VectorRecord;
import ru.javaboys.huntymatch.dto.VectorizationReport;
import ru.javaboys.huntymatch.entity.Job;
import ru.javaboys.huntymatch.service.EmbeddingProvider;
import ru.javaboys.huntymatch.service.JobStore;
import ru.javaboys.huntymatch.service.VectorIndex;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates job embeddings in rate-limited batches and pushes them into the vector index.
 * A job whose embedding or upsert fails is skipped and stays unvectorized; the run goes on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobVectorizationService {

    private final JobStore jobStore;
    private final EmbeddingProvider embeddingProvider;
    private final VectorIndex vectorIndex;
    private final VectorizationProperties properties;

    public VectorizationReport vectorizeMissing() {
        List<Job> missing = jobStore.getAllJobs().stream()
                .filter(j -> !j.hasEmbedding())
                .toList();
        if (missing.isEmpty()) {
            log.debug("All jobs already have embeddings");
            return new VectorizationReport(0, 0, 0, 0);
        }
        return vectorizeJobs(missing);
    }

    public VectorizationReport vectorizeJobs(List<Job> jobs) {
        int batchSize = properties.getBatchSize();
        int batches = (jobs.size() + batchSize - 1) / batchSize;
        log.info("Generating embeddings for {} jobs in {} batches", jobs.size(), batches);

        List<VectorRecord> records = new ArrayList<>(jobs.size());
        List<Long> jobIds = new ArrayList<>(jobs.size());
        for (int i = 0; i < jobs.size(); i += batchSize) {
            List<Job> batch = jobs.subList(i, Math.min(i + batchSize, jobs.size()));
            for (Job job : batch) {
                try {
                    float[] vector = embeddingProvider.embed(EmbeddingTemplates.jobText(job));
                    records.add(new VectorRecord(CandidateRetriever.toIndexId(job.getId()), vector, metadata(job)));
                    jobIds.add(job.getId());
                } catch (Exception e) {
                    log.warn("Failed to generate embedding for job {}: {}", job.getId(), e.getMessage());
                }
            }
            log.info("Processed batch {}/{} ({}/{} embedded)", i / batchSize + 1, batches, records.size(), jobs.size());

            if (i + batchSize < jobs.size() && !pause()) {
                log.warn("Vectorization interrupted after {} jobs", i + batch.size());
                break;
            }
        }

        int upserted = upsert(records, jobIds);
        int failed = jobs.size() - upserted;
        log.info("Vectorization finished: {} embedded, {} upserted, {} failed", records.size(), upserted, failed);
        return new VectorizationReport(jobs.size(), upserted, failed, upserted);
    }

    public void clearIndex() {
        vectorIndex.deleteAll();
    }

    public IndexStats indexStats() {
        try {
            return vectorIndex.stats();
        } catch (Exception e) {
            log.warn("Unable to fetch index stats: {}", e.getMessage());
            return IndexStats.empty();
        }
    }

    /**
     * Embeddings are attached to jobs only once their chunk is in the index, so a failed chunk
     * is picked up again by the next {@link #vectorizeMissing()}.
     */
    private int upsert(List<VectorRecord> records, List<Long> jobIds) {
        int chunk = properties.getUpsertChunkSize();
        int upserted = 0;
        for (int i = 0; i < records.size(); i += chunk) {
            int end = Math.min(i + chunk, records.size());
            List<VectorRecord> slice = records.subList(i, end);
            try {
                vectorIndex.upsert(slice);
            } catch (Exception e) {
                log.warn("Upsert of vectors {}..{} failed, jobs stay unvectorized: {}", i, end, e.getMessage());
                continue;
            }
            for (int j = i; j < end; j++) {
                jobStore.updateJobEmbedding(jobIds.get(j), records.get(j).values());
            }
            upserted += slice.size();
        }
        return upserted;
    }

    private boolean pause() {
        long ms = properties.getBatchDelay().toMillis();
        if (ms <= 0) {
            return true;
        }
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static Map<String, Object> metadata(Job job) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("job_id", job.getId());
        m.put("title", job.getTitle());
        m.put("company", job.getCompany());
        m.put("location", job.getLocation());
        m.put("experience_level", job.getExperienceLevel().getId());
        m.put("work_type", job.getWorkType().getId());
        m.put("industry", job.getIndustry());
        return m;
    }
}
