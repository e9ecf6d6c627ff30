package ru.javaboys.huntymatch.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import ru.javaboys.huntymatch.dto.IndexStats;
import ru.javaboys.huntymatch.dto.VectorMatch;
import ru.javaboys.huntymatch.dto.VectorRecord;
import ru.javaboys.huntymatch.exception.ServiceUnavailableException;
import ru.javaboys.huntymatch.service.VectorIndex;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pinecone data-plane client over REST.
 */
@Slf4j
@Component
public class PineconeVectorIndex implements VectorIndex {

    private static final String SERVICE = "vector-index";

    private final WebClient web;
    private final Duration timeout;

    public PineconeVectorIndex(@Qualifier("pineconeWebClient") WebClient web,
                               @Value("${hunty.pinecone.timeout-seconds:10}") long timeoutSeconds) {
        this.web = web;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public void upsert(List<VectorRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        List<UpsertVector> vectors = new ArrayList<>(records.size());
        for (VectorRecord r : records) {
            vectors.add(new UpsertVector(r.id(), r.values(), r.metadata()));
        }
        UpsertResponse resp = post("/vectors/upsert", new UpsertRequest(vectors), UpsertResponse.class);
        log.debug("Upserted {} vectors (acknowledged {})", records.size(), resp == null ? null : resp.upsertedCount());
    }

    @Override
    public List<VectorMatch> query(float[] vector, int topK, @Nullable Map<String, Object> filter) {
        QueryResponse resp = post("/query", new QueryRequest(vector, topK, true, false, filter), QueryResponse.class);
        if (resp == null || resp.matches() == null) {
            return List.of();
        }
        List<VectorMatch> out = new ArrayList<>(resp.matches().size());
        for (QueryMatch m : resp.matches()) {
            if (m == null || m.id() == null) continue;
            out.add(new VectorMatch(m.id(), m.score() == null ? 0.0 : m.score(),
                    m.metadata() == null ? Map.of() : m.metadata()));
        }
        return out;
    }

    @Override
    public void deleteAll() {
        post("/vectors/delete", new DeleteRequest(true), Map.class);
        log.info("All vectors deleted from the index");
    }

    @Override
    public IndexStats stats() {
        StatsResponse resp = post("/describe_index_stats", Map.of(), StatsResponse.class);
        if (resp == null) {
            return IndexStats.empty();
        }
        return new IndexStats(resp.totalVectorCount() == null ? 0 : resp.totalVectorCount(),
                resp.dimension() == null ? 0 : resp.dimension());
    }

    private <T> T post(String path, Object body, Class<T> type) {
        try {
            return web.post()
                    .uri(path)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(type)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            log.warn("Pinecone call {} failed: {}", path, e.getMessage());
            throw new ServiceUnavailableException(SERVICE, path + " failed", e);
        }
    }

    // --- Pinecone wire DTOs ---

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UpsertVector(String id, float[] values, Map<String, Object> metadata) {}

    public record UpsertRequest(List<UpsertVector> vectors) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UpsertResponse(Long upsertedCount) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record QueryRequest(float[] vector, int topK, boolean includeMetadata, boolean includeValues,
                        Map<String, Object> filter) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QueryMatch(String id, Double score, Map<String, Object> metadata) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QueryResponse(List<QueryMatch> matches) {}

    public record DeleteRequest(boolean deleteAll) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StatsResponse(Integer dimension, Long totalVectorCount) {}
}
