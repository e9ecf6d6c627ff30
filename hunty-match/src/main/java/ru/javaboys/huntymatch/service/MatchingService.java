package ru.javaboys.huntymatch.service;

import ru.javaboys.huntymatch.dto.MatchingOptions;
import ru.javaboys.huntymatch.dto.MatchingResponse;
import ru.javaboys.huntymatch.entity.JobMatchEntity;

import java.util.List;

public interface MatchingService {

    MatchingResponse findMatches(long resumeId, int limit);

    MatchingResponse findMatches(long resumeId, MatchingOptions options);

    List<JobMatchEntity> getMatchHistory(long resumeId);
}
