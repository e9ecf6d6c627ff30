package ru.javaboys.huntymatch.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.config.MatchingProperties;
import ru.javaboys.huntymatch.dto.RetrievedCandidate;
import ru.javaboys.huntymatch.dto.VectorMatch;
import ru.javaboys.huntymatch.entity.Job;
import ru.javaboys.huntymatch.exception.InvalidInputException;
import ru.javaboys.huntymatch.service.JobStore;
import ru.javaboys.huntymatch.service.VectorIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Nearest-neighbour lookup of jobs for a résumé vector. Asks the index for more hits than
 * will be shown, since diversification throws near-duplicates away.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateRetriever {

    public static final String ID_PREFIX = "job_";
    private static final Pattern JOB_ID = Pattern.compile("^" + ID_PREFIX + "(\\d+)$");

    private final VectorIndex vectorIndex;
    private final JobStore jobStore;
    private final MatchingProperties properties;

    public List<RetrievedCandidate> retrieve(float[] resumeVector, int finalResults) {
        return retrieve(resumeVector, finalResults, List.of());
    }

    /**
     * @param finalResults how many candidates diversification will keep
     * @param industries   restrict hits to these industries; empty means no restriction
     */
    public List<RetrievedCandidate> retrieve(float[] resumeVector, int finalResults, List<String> industries) {
        if (resumeVector == null || resumeVector.length == 0) {
            throw new InvalidInputException("Résumé vector is required for retrieval");
        }
        int topK = properties.overFetch(finalResults);

        Map<String, Object> filter = null;
        if (industries != null && !industries.isEmpty()) {
            filter = Map.of("industry", Map.of("$in", List.copyOf(industries)));
        }

        List<VectorMatch> hits = vectorIndex.query(resumeVector, topK, filter);
        log.debug("Vector index returned {} hits for topK={}", hits.size(), topK);

        List<RetrievedCandidate> out = new ArrayList<>(hits.size());
        int unresolved = 0;
        for (VectorMatch hit : hits) {
            if (hit.score() < properties.getMinVectorScore()) {
                continue;
            }
            OptionalLong jobId = parseJobId(hit.id());
            if (jobId.isEmpty()) {
                log.warn("Skipping index hit with unexpected id '{}'", hit.id());
                unresolved++;
                continue;
            }
            Optional<Job> job = jobStore.getJobById(jobId.getAsLong());
            if (job.isEmpty()) {
                log.warn("Index hit {} has no job in the store, skipping", hit.id());
                unresolved++;
                continue;
            }
            out.add(new RetrievedCandidate(job.get(), hit.score()));
        }
        if (unresolved > 0) {
            log.info("Retrieved {} candidates, {} index hits could not be resolved", out.size(), unresolved);
        }
        return out;
    }

    public static String toIndexId(long jobId) {
        return ID_PREFIX + jobId;
    }

    static OptionalLong parseJobId(String indexId) {
        if (StringUtils.isBlank(indexId)) {
            return OptionalLong.empty();
        }
        Matcher m = JOB_ID.matcher(indexId.trim());
        if (!m.matches()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(m.group(1)));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
