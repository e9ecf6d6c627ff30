package ru.javaboys.huntymatch.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.dto.MatchResult;
import ru.javaboys.huntymatch.entity.Job;
import ru.javaboys.huntymatch.exception.InvalidInputException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Greedy Maximal Marginal Relevance over company, location and industry repetition.
 * Not globally optimal; ties go to the earlier candidate.
 */
@Slf4j
@Service
public class MmrDiversifier {

    static final double COMPANY_PENALTY = 0.3;
    static final double LOCATION_PENALTY = 0.8;
    static final double INDUSTRY_PENALTY = 0.9;
    static final int LOCATION_CLUSTER = 2;
    static final int INDUSTRY_CLUSTER = 3;

    /**
     * @param ranked     matches sorted by relevance, best first
     * @param lambda     weight of relevance against diversity, in [0, 1]
     * @param maxResults upper bound of the result size
     */
    public List<MatchResult> diversify(List<MatchResult> ranked, double lambda, int maxResults) {
        if (lambda < 0 || lambda > 1 || Double.isNaN(lambda)) {
            throw new InvalidInputException("MMR lambda must be within [0, 1]: " + lambda);
        }
        if (maxResults < 0) {
            throw new InvalidInputException("maxResults must be non-negative: " + maxResults);
        }
        if (ranked == null || ranked.isEmpty()) {
            return List.of();
        }

        List<MatchResult> pool = dedupe(ranked);
        if (pool.size() <= maxResults) {
            return pool;
        }

        List<MatchResult> selected = new ArrayList<>(maxResults);
        Map<String, Integer> companies = new HashMap<>();
        Map<String, Integer> locations = new HashMap<>();
        Map<String, Integer> industries = new HashMap<>();

        while (selected.size() < maxResults && !pool.isEmpty()) {
            int bestIdx = 0;
            if (selected.isEmpty()) {
                double bestScore = Double.NEGATIVE_INFINITY;
                for (int i = 0; i < pool.size(); i++) {
                    if (pool.get(i).getMatchScore() > bestScore) {
                        bestScore = pool.get(i).getMatchScore();
                        bestIdx = i;
                    }
                }
            } else {
                double bestMmr = Double.NEGATIVE_INFINITY;
                for (int i = 0; i < pool.size(); i++) {
                    MatchResult c = pool.get(i);
                    double diversity = diversity(c.getJob(), companies, locations, industries);
                    double mmr = lambda * c.getMatchScore() + (1 - lambda) * diversity;
                    if (mmr > bestMmr) {
                        bestMmr = mmr;
                        bestIdx = i;
                    }
                }
            }

            MatchResult pick = pool.remove(bestIdx);
            selected.add(pick);
            companies.merge(key(pick.getJob().getCompany()), 1, Integer::sum);
            locations.merge(key(pick.getJob().getLocation()), 1, Integer::sum);
            industries.merge(key(pick.getJob().getIndustry()), 1, Integer::sum);
        }

        log.debug("Diversified {} matches down to {} across {} companies",
                ranked.size(), selected.size(), companies.size());
        return selected;
    }

    static double diversity(Job job,
                            Map<String, Integer> companies,
                            Map<String, Integer> locations,
                            Map<String, Integer> industries) {
        double diversity = 1.0;
        int sameCompany = companies.getOrDefault(key(job.getCompany()), 0);
        if (sameCompany > 0) {
            diversity *= Math.pow(COMPANY_PENALTY, sameCompany);
        }
        if (locations.getOrDefault(key(job.getLocation()), 0) > LOCATION_CLUSTER) {
            diversity *= LOCATION_PENALTY;
        }
        if (industries.getOrDefault(key(job.getIndustry()), 0) > INDUSTRY_CLUSTER) {
            diversity *= INDUSTRY_PENALTY;
        }
        return diversity;
    }

    private static List<MatchResult> dedupe(List<MatchResult> ranked) {
        Set<Long> seen = new HashSet<>();
        List<MatchResult> out = new ArrayList<>(ranked.size());
        for (MatchResult m : ranked) {
            if (m != null && m.getJob() != null && seen.add(m.getJob().getId())) {
                out.add(m);
            }
        }
        return out;
    }

    private static String key(String s) {
        return StringUtils.defaultString(s).trim().toLowerCase(Locale.ROOT);
    }
}
