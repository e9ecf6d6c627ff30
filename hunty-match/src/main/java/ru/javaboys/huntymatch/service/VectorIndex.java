package ru.javaboys.huntymatch.service;

import org.springframework.lang.Nullable;
import ru.javaboys.huntymatch.dto.IndexStats;
import ru.javaboys.huntymatch.dto.VectorMatch;
import ru.javaboys.huntymatch.dto.VectorRecord;

import java.util.List;
import java.util.Map;

/**
 * External nearest-neighbour index. Implementations throw
 * {@link ru.javaboys.huntymatch.exception.ServiceUnavailableException} when the service fails.
 */
public interface VectorIndex {

    void upsert(List<VectorRecord> records);

    /**
     * @param filter metadata predicate, e.g. {@code {"industry": {"$in": ["Fintech"]}}}
     */
    List<VectorMatch> query(float[] vector, int topK, @Nullable Map<String, Object> filter);

    void deleteAll();

    IndexStats stats();
}
