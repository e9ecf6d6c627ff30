package ru.javaboys.huntymatch.ai;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import ru.javaboys.huntymatch.ai.dto.AppropriatenessReviewDto;
import ru.javaboys.huntymatch.ai.dto.AppropriatenessReviewDto.JobDecisionDto;
import ru.javaboys.huntymatch.dto.FilterOutcome;
import ru.javaboys.huntymatch.dto.MatchResult;
import ru.javaboys.huntymatch.dto.RejectedMatch;
import ru.javaboys.huntymatch.entity.ConfidenceLevelEnum;
import ru.javaboys.huntymatch.entity.Job;
import ru.javaboys.huntymatch.entity.ResumeProfile;
import ru.javaboys.huntymatch.service.AppropriatenessFilter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Asks the reasoning service whether each match is appropriate for the candidate.
 * Fails open: if the service errors or answers garbage, the candidates pass through unchanged.
 */
@Slf4j
@RequiredArgsConstructor
public class LlmAppropriatenessFilter implements AppropriatenessFilter {

    static final int MAX_REVIEWED_JOBS = 20;
    private static final int PROFILE_SKILLS = 10;
    private static final int JOB_SKILLS = 5;

    private static final SystemMessage SYSTEM = new SystemMessage("""
            You are an expert career counselor. Decide whether each job opportunity is an appropriate match
            for the candidate.

            Filtering criteria:
            1. Experience level: do not keep roles far above the candidate's level (e.g. VP roles for a
               mid-level engineer) or far below it (e.g. intern roles for a senior engineer). One or two
               levels up is reasonable career progression.
            2. Title relevance: the title should align with the candidate's background and domain.
               Flag roles completely unrelated to their experience.
            3. Skill alignment: filter out major skill mismatches, but consider transferable skills.

            For each job decide KEEP or FILTER_OUT. Optionally adjust confidence with INCREASE or DECREASE,
            otherwise use NONE.

            Return exactly one JSON object, no markdown, no extra text:
            {
              "analysis": [
                {"jobId": 0, "decision": "KEEP", "reason": "short explanation", "confidenceAdjustment": "NONE"}
              ],
              "summary": "overall assessment of the candidate's job market fit"
            }
            Be practical but not overly restrictive.
            """);

    private final OpenAiService openAiService;

    @Override
    public FilterOutcome filter(ResumeProfile profile, List<MatchResult> candidates, int topK) {
        if (candidates == null || candidates.isEmpty()) {
            return new FilterOutcome(List.of(), List.of(), false);
        }
        List<MatchResult> reviewed = candidates.subList(0, Math.min(MAX_REVIEWED_JOBS, candidates.size()));

        AppropriatenessReviewDto review;
        try {
            review = openAiService.structuredTalkToChatGPT(
                    "appropriateness-" + UUID.randomUUID(), SYSTEM, buildUserMessage(profile, reviewed),
                    AppropriatenessReviewDto.class);
        } catch (Exception e) {
            log.warn("Appropriateness review failed, passing {} candidates through: {}", candidates.size(), e.getMessage());
            return FilterOutcome.unfiltered(candidates, topK, true);
        }

        if (review == null || review.getAnalysis() == null) {
            log.warn("Appropriateness review returned no analysis, passing candidates through");
            return FilterOutcome.unfiltered(candidates, topK, true);
        }

        List<MatchResult> kept = new ArrayList<>();
        List<RejectedMatch> rejected = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (JobDecisionDto d : review.getAnalysis()) {
            if (d == null || d.getJobId() == null) continue;
            int idx = d.getJobId();
            if (idx < 0 || idx >= reviewed.size() || !seen.add(idx)) continue;

            MatchResult match = reviewed.get(idx);
            String reason = StringUtils.defaultIfBlank(d.getReason(), "no reason given");
            if ("KEEP".equals(normalize(d.getDecision()))) {
                kept.add(adjust(match, d.getConfidenceAdjustment()));
                log.debug("Keeping {} - {}", match.getJob().getTitle(), reason);
            } else {
                rejected.add(new RejectedMatch(match, reason));
                log.debug("Filtering out {} - {}", match.getJob().getTitle(), reason);
            }
        }

        if (seen.isEmpty()) {
            log.warn("Appropriateness review referenced none of the {} reviewed jobs, passing candidates through", reviewed.size());
            return FilterOutcome.unfiltered(candidates, topK, true);
        }

        kept.sort(Comparator.comparingDouble(MatchResult::getMatchScore).reversed());
        List<MatchResult> top = kept.subList(0, Math.min(Math.max(topK, 0), kept.size()));
        log.info("Appropriateness review kept {} of {} (rejected {}). Summary: {}",
                top.size(), reviewed.size(), rejected.size(), StringUtils.abbreviate(review.getSummary(), 300));
        return new FilterOutcome(List.copyOf(top), List.copyOf(rejected), false);
    }

    static MatchResult adjust(MatchResult match, String adjustment) {
        ConfidenceLevelEnum c = match.getConfidence();
        return switch (normalize(adjustment)) {
            case "INCREASE" -> match.withConfidence(c.increase());
            case "DECREASE" -> match.withConfidence(c.decrease());
            default -> match;
        };
    }

    static UserMessage buildUserMessage(ResumeProfile profile, List<MatchResult> reviewed) {
        StringBuilder jobs = new StringBuilder();
        for (int i = 0; i < reviewed.size(); i++) {
            MatchResult m = reviewed.get(i);
            Job job = m.getJob();
            List<String> skills = job.getSkills();
            jobs.append(String.format(Locale.US, "ID %d: %s at %s (%s) - Skills: %s - Current Match: %.0f%% - Confidence: %s%n",
                    i, job.getTitle(), job.getCompany(), job.getExperienceLevel().getId(),
                    String.join(", ", skills.subList(0, Math.min(JOB_SKILLS, skills.size()))),
                    m.getMatchScore() * 100, m.getConfidence().getId()));
        }

        List<String> skills = profile.getSkills();
        return new UserMessage("""
                CANDIDATE PROFILE:
                - Primary role: %s
                - Years of experience: %s
                - Current level: %s
                - Key skills: %s
                - Industries: %s

                JOB OPPORTUNITIES TO ANALYZE:
                %s
                """.formatted(
                StringUtils.defaultIfBlank(profile.getPrimaryRole(), "Not specified"),
                formatYears(profile.getYearsOfExperience()),
                profile.getExperienceLevel().getId(),
                String.join(", ", skills.subList(0, Math.min(PROFILE_SKILLS, skills.size()))),
                profile.getIndustries().isEmpty() ? "Not specified" : String.join(", ", profile.getIndustries()),
                jobs.toString().trim()));
    }

    private static String formatYears(double years) {
        return years == Math.rint(years) ? String.valueOf((long) years) : String.format(Locale.US, "%.1f", years);
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().toUpperCase(Locale.ROOT);
    }
}
