package ru.javaboys.huntymatch.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.javaboys.huntymatch.config.MatchingProperties;
import ru.javaboys.huntymatch.dto.RetrievedCandidate;
import ru.javaboys.huntymatch.dto.VectorRecord;
import ru.javaboys.huntymatch.exception.InvalidInputException;
import ru.javaboys.huntymatch.exception.ServiceUnavailableException;
import ru.javaboys.huntymatch.support.InMemoryVectorIndex;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static ru.javaboys.huntymatch.support.TestData.job;

class CandidateRetrieverTest {

    private InMemoryVectorIndex index;
    private InMemoryJobStore store;
    private CandidateRetriever retriever;

    @BeforeEach
    void setUp() {
        index = new InMemoryVectorIndex();
        store = new InMemoryJobStore();
        retriever = new CandidateRetriever(index, store, MatchingProperties.defaults());

        store.createJob(job(1, "Acme", "NYC", "Technology"));
        store.createJob(job(2, "Globex", "Boston", "Finance"));
        index.upsert(List.of(
                new VectorRecord("job_1", new float[]{1f, 0f}, Map.of("industry", "Technology")),
                new VectorRecord("job_2", new float[]{0.6f, 0.8f}, Map.of("industry", "Finance")),
                new VectorRecord("job_99", new float[]{0.9f, 0.1f}, Map.of("industry", "Technology")),
                new VectorRecord("legacy-7", new float[]{1f, 0.05f}, Map.of("industry", "Technology"))));
    }

    @Test
    void overFetchesAndResolvesJobs() {
        List<RetrievedCandidate> out = retriever.retrieve(new float[]{1f, 0f}, 10);

        assertThat(index.getLastTopK()).isEqualTo(50);
        assertThat(index.getLastFilter()).isNull();
        assertThat(out).extracting(c -> c.job().getId()).containsExactly(1L, 2L);
        assertThat(out.get(0).similarity()).isEqualTo(1.0);
    }

    @Test
    void overFetchGrowsWithLimit() {
        retriever.retrieve(new float[]{1f, 0f}, 30);

        assertThat(index.getLastTopK()).isEqualTo(75);
    }

    @Test
    void passesIndustryFilter() {
        List<RetrievedCandidate> out = retriever.retrieve(new float[]{1f, 0f}, 5, List.of("Finance"));

        assertThat(index.getLastFilter()).isEqualTo(Map.of("industry", Map.of("$in", List.of("Finance"))));
        assertThat(out).extracting(c -> c.job().getId()).containsExactly(2L);
    }

    @Test
    void dropsHitsBelowMinimumScore() {
        CandidateRetriever strict = new CandidateRetriever(index, store,
                MatchingProperties.defaults().toBuilder().minVectorScore(0.7).build());

        List<RetrievedCandidate> out = strict.retrieve(new float[]{1f, 0f}, 5);

        assertThat(out).extracting(c -> c.job().getId()).containsExactly(1L);
    }

    @Test
    void indexFailurePropagates() {
        index.setDown(true);

        assertThatThrownBy(() -> retriever.retrieve(new float[]{1f, 0f}, 5))
                .isInstanceOf(ServiceUnavailableException.class);
    }

    @Test
    void emptyVectorIsRejected() {
        assertThatThrownBy(() -> retriever.retrieve(new float[0], 5)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void parsesIndexIds() {
        assertThat(CandidateRetriever.toIndexId(12)).isEqualTo("job_12");
        assertThat(CandidateRetriever.parseJobId("job_12")).hasValue(12L);
        assertThat(CandidateRetriever.parseJobId(" job_3 ")).hasValue(3L);
        assertThat(CandidateRetriever.parseJobId("job_")).isEmpty();
        assertThat(CandidateRetriever.parseJobId("job_abc")).isEmpty();
        assertThat(CandidateRetriever.parseJobId(null)).isEmpty();
        assertThat(CandidateRetriever.parseJobId("job_99999999999999999999")).isEmpty();
    }
}
