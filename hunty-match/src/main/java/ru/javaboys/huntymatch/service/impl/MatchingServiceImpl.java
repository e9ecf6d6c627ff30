package ru.javaboys.huntymatch.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.config.MatchingProperties;
import ru.javaboys.huntymatch.dto.FilterOutcome;
import ru.javaboys.huntymatch.dto.MatchResult;
import ru.javaboys.huntymatch.dto.MatchingOptions;
import ru.javaboys.huntymatch.dto.MatchingPathEnum;
import ru.javaboys.huntymatch.dto.MatchingResponse;
import ru.javaboys.huntymatch.dto.MatchingStageEnum;
import ru.javaboys.huntymatch.dto.MatchingStats;
import ru.javaboys.huntymatch.dto.RetrievedCandidate;
import ru.javaboys.huntymatch.entity.Job;
import ru.javaboys.huntymatch.entity.JobMatchEntity;
import ru.javaboys.huntymatch.entity.Resume;
import ru.javaboys.huntymatch.exception.InvalidInputException;
import ru.javaboys.huntymatch.exception.PersistenceFailureException;
import ru.javaboys.huntymatch.scoring.CompositeMatchScorer;
import ru.javaboys.huntymatch.service.AppropriatenessFilter;
import ru.javaboys.huntymatch.service.EmbeddingProvider;
import ru.javaboys.huntymatch.service.JobStore;
import ru.javaboys.huntymatch.service.MatchingService;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Retrieve, score, diversify, filter, persist. Falls back to scoring the whole corpus in-process
 * when the vector path cannot produce candidates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchingServiceImpl implements MatchingService {

    static final String MDC_RESUME_ID = "resumeId";

    private static final Comparator<MatchResult> BY_SCORE_DESC =
            Comparator.comparingDouble(MatchResult::getMatchScore).reversed();

    private final JobStore jobStore;
    private final EmbeddingProvider embeddingProvider;
    private final CandidateRetriever candidateRetriever;
    private final CompositeMatchScorer scorer;
    private final MmrDiversifier diversifier;
    private final AppropriatenessFilter appropriatenessFilter;
    private final MatchingProperties properties;

    @Override
    public MatchingResponse findMatches(long resumeId, int limit) {
        return findMatches(resumeId, MatchingOptions.ofLimit(limit));
    }

    @Override
    public MatchingResponse findMatches(long resumeId, MatchingOptions options) {
        if (options == null || options.getLimit() < 1) {
            throw new InvalidInputException("limit must be at least 1");
        }
        long started = System.nanoTime();
        MDC.put(MDC_RESUME_ID, String.valueOf(resumeId));
        try {
            Resume resume = jobStore.getResumeById(resumeId)
                    .orElseThrow(() -> new InvalidInputException("Resume not found: " + resumeId));
            if (resume.getProfile() == null) {
                throw new InvalidInputException("Resume " + resumeId + " has no parsed profile");
            }

            MatchingPathEnum path = MatchingPathEnum.VECTOR;
            List<MatchResult> matches = vectorMatches(resume, options).orElse(null);
            if (matches == null) {
                path = MatchingPathEnum.FALLBACK;
                matches = fallbackMatches(resume, options);
            }

            stage(MatchingStageEnum.PERSISTING);
            persist(resumeId, matches);
            stage(MatchingStageEnum.DONE);

            MatchingStats stats = MatchingStats.builder()
                    .totalJobs(jobStore.countJobs())
                    .matchesFound(matches.size())
                    .avgMatchScore(averageScore(matches))
                    .processingTime(elapsed(started))
                    .path(path)
                    .build();
            log.info("Found {} matches for resume {} via {} in {}",
                    matches.size(), resumeId, path, stats.getProcessingTime());
            return new MatchingResponse(List.copyOf(matches), stats);
        } finally {
            MDC.remove(MDC_RESUME_ID);
        }
    }

    @Override
    public List<JobMatchEntity> getMatchHistory(long resumeId) {
        return jobStore.getJobMatchesByResumeId(resumeId);
    }

    /**
     * @return empty when the request has to take the fallback path
     */
    private Optional<List<MatchResult>> vectorMatches(Resume resume, MatchingOptions options) {
        int limit = options.getLimit();
        int poolSize = properties.filterPoolSize(limit);

        stage(MatchingStageEnum.RETRIEVING);
        List<RetrievedCandidate> candidates;
        try {
            float[] vector = resumeVector(resume);
            // sized for the diversified pool, not just the final page
            candidates = candidateRetriever.retrieve(vector, poolSize, options.getIndustryFilter());
        } catch (RuntimeException e) {
            log.warn("Stage {} -> {}: vector retrieval failed, using fallback: {}",
                    MatchingStageEnum.RETRIEVING, MatchingStageEnum.FAILED, e.getMessage());
            return Optional.empty();
        }
        if (candidates.isEmpty()) {
            log.warn("Stage {} -> {}: no candidates retrieved, using fallback",
                    MatchingStageEnum.RETRIEVING, MatchingStageEnum.FAILED);
            return Optional.empty();
        }

        stage(MatchingStageEnum.SCORING);
        List<MatchResult> scored = new ArrayList<>(candidates.size());
        for (RetrievedCandidate c : candidates) {
            scored.add(scorer.score(c.job(), resume, c.similarity()));
        }
        scored.sort(BY_SCORE_DESC);

        stage(MatchingStageEnum.DIVERSIFYING);
        List<MatchResult> pool = options.isDiversify()
                ? diversifier.diversify(scored, properties.getMmrLambda(), poolSize)
                : scored.subList(0, Math.min(poolSize, scored.size()));

        stage(MatchingStageEnum.FILTERING);
        FilterOutcome outcome;
        try {
            outcome = appropriatenessFilter.filter(resume.getProfile(), pool, limit);
        } catch (RuntimeException e) {
            log.warn("Stage {} -> {}: appropriateness filter failed, using fallback",
                    MatchingStageEnum.FILTERING, MatchingStageEnum.FAILED, e);
            return Optional.empty();
        }
        if (outcome.failedOpen()) {
            log.info("Appropriateness filter unavailable, kept top {} unreviewed", outcome.kept().size());
        } else if (!outcome.rejected().isEmpty()) {
            log.debug("Appropriateness filter rejected {} of {} candidates", outcome.rejected().size(), pool.size());
        }
        return Optional.of(outcome.kept());
    }

    private float[] resumeVector(Resume resume) {
        if (resume.hasEmbedding()) {
            return resume.getEmbedding();
        }
        float[] vector = embeddingProvider.embed(EmbeddingTemplates.resumeText(resume));
        resume.attachEmbedding(vector);
        return vector;
    }

    private List<MatchResult> fallbackMatches(Resume resume, MatchingOptions options) {
        Set<String> industries = options.getIndustryFilter().stream()
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        stage(MatchingStageEnum.SCORING);
        List<MatchResult> scored = new ArrayList<>();
        for (Job job : jobStore.getAllJobs()) {
            if (!industries.isEmpty() && !industries.contains(job.getIndustry().trim().toLowerCase(Locale.ROOT))) {
                continue;
            }
            scored.add(scorer.score(job, resume));
        }
        scored.sort(BY_SCORE_DESC);
        return scored.subList(0, Math.min(options.getLimit(), scored.size()));
    }

    private void persist(long resumeId, List<MatchResult> matches) {
        for (MatchResult m : matches) {
            JobMatchEntity entity = JobMatchEntity.builder()
                    .resumeId(resumeId)
                    .jobId(m.getJob().getId())
                    .matchScore(m.getMatchScore())
                    .matchingSkills(m.getMatchingSkills())
                    .confidence(m.getConfidence())
                    .explanation(m.getExplanation())
                    .build();
            try {
                jobStore.createJobMatch(entity);
            } catch (RuntimeException e) {
                PersistenceFailureException failure = new PersistenceFailureException(
                        "Unable to store match of resume " + resumeId + " with job " + m.getJob().getId(), e);
                log.warn(failure.getMessage(), failure);
            }
        }
    }

    private static void stage(MatchingStageEnum stage) {
        log.debug("Matching stage -> {}", stage);
    }

    static String averageScore(List<MatchResult> matches) {
        if (matches.isEmpty()) {
            return "-";
        }
        double avg = matches.stream().mapToDouble(MatchResult::getMatchScore).average().orElse(0);
        return Math.round(avg * 100) + "%";
    }

    private static String elapsed(long startedNanos) {
        double seconds = (System.nanoTime() - startedNanos) / 1_000_000_000.0;
        return String.format(Locale.US, "%.1fs", seconds);
    }
}
