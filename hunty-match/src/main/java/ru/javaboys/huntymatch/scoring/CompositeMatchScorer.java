package ru.javaboys.huntymatch.scoring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.dto.MatchResult;
import ru.javaboys.huntymatch.entity.ConfidenceLevelEnum;
import ru.javaboys.huntymatch.entity.Job;
import ru.javaboys.huntymatch.entity.Resume;
import ru.javaboys.huntymatch.entity.ResumeProfile;
import ru.javaboys.huntymatch.exception.InvalidInputException;

import java.util.List;
import java.util.Locale;

/**
 * Combines vector similarity, skill overlap and experience alignment into one score
 * plus a confidence tier. Vector similarity is the primary signal when present.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompositeMatchScorer {

    private static final int EXPLAINED_SKILLS = 3;

    private final ScoringConfig config;

    /**
     * Scores with the cosine of the two stored embeddings, when both exist.
     */
    public MatchResult score(Job job, Resume resume) {
        requireInput(job, resume);
        double vectorScore = 0;
        if (job.hasEmbedding() && resume.hasEmbedding()) {
            vectorScore = CosineSimilarity.cosineSimilarity(job.getEmbedding(), resume.getEmbedding());
        }
        return score(job, resume, vectorScore);
    }

    /**
     * Scores with a similarity computed elsewhere (e.g. by the vector index).
     * Values &lt;= 0 mean "no vector signal" and switch to the skill/experience weighting.
     */
    public MatchResult score(Job job, Resume resume, double vectorSimilarity) {
        requireInput(job, resume);
        ResumeProfile profile = resume.getProfile();

        double vectorScore = Double.isNaN(vectorSimilarity) ? 0 : Math.max(0, vectorSimilarity);
        boolean hasVector = vectorScore > 0;

        SkillOverlap overlap = SkillOverlapScorer.overlap(job.getSkills(), profile.getSkills());
        double experience = ExperienceAlignmentScorer.alignment(job.getExperienceLevel(), profile.getExperienceLevel());

        double finalScore;
        if (hasVector) {
            finalScore = vectorScore * config.getVectorWeight()
                    + overlap.score() * config.getSkillWeight()
                    + experience * config.getExperienceWeight();
        } else {
            finalScore = overlap.score() * config.getFallbackSkillWeight()
                    + experience * config.getFallbackExperienceWeight();
        }
        finalScore = round2(clamp(finalScore));

        ConfidenceLevelEnum confidence = hasVector
                ? confidenceWithVector(finalScore, overlap.count())
                : confidenceWithoutVector(overlap.score(), overlap.count());

        if (log.isTraceEnabled()) {
            log.trace("Job {} '{}': skills {}/{}, overlap {}, vector {}, experience {}, final {} ({})",
                    job.getId(), job.getTitle(), overlap.count(), job.getSkills().size(),
                    overlap.score(), vectorScore, experience, finalScore, confidence);
        }

        return MatchResult.builder()
                .job(job)
                .matchScore(finalScore)
                .matchingSkills(overlap.matchingSkills())
                .confidence(confidence)
                .explanation(explain(hasVector, vectorScore, overlap, experience, finalScore))
                .vectorScore(vectorScore)
                .build();
    }

    private ConfidenceLevelEnum confidenceWithVector(double finalScore, int matches) {
        if (finalScore >= config.getHighScoreThreshold() && matches >= config.getHighMinSkills()) {
            return ConfidenceLevelEnum.HIGH;
        }
        if (finalScore >= config.getMediumScoreThreshold() && matches >= config.getMediumMinSkills()) {
            return ConfidenceLevelEnum.MEDIUM;
        }
        return ConfidenceLevelEnum.LOW;
    }

    private ConfidenceLevelEnum confidenceWithoutVector(double skillOverlap, int matches) {
        if (skillOverlap >= config.getFallbackHighOverlap() && matches >= config.getFallbackHighMinSkills()) {
            return ConfidenceLevelEnum.HIGH;
        }
        if (skillOverlap >= config.getFallbackMediumOverlap() && matches >= config.getFallbackMediumMinSkills()) {
            return ConfidenceLevelEnum.MEDIUM;
        }
        return ConfidenceLevelEnum.LOW;
    }

    private static String explain(boolean hasVector, double vectorScore, SkillOverlap overlap,
                                  double experience, double finalScore) {
        StringBuilder expl = new StringBuilder();
        if (hasVector) {
            expl.append(String.format(Locale.US, "Vector similarity: %.1f%%", vectorScore * 100));
        } else {
            expl.append("Vector similarity: unavailable");
        }
        expl.append(String.format(Locale.US, " | Skill overlap: %.1f%%", overlap.score() * 100));
        expl.append(String.format(Locale.US, " | Experience alignment: %.1f%%", experience * 100));

        List<String> skills = overlap.matchingSkills();
        if (!skills.isEmpty()) {
            expl.append(" | Matching skills: ")
                    .append(String.join(", ", skills.subList(0, Math.min(EXPLAINED_SKILLS, skills.size()))));
            if (skills.size() > EXPLAINED_SKILLS) {
                expl.append(" +").append(skills.size() - EXPLAINED_SKILLS).append(" more");
            }
        }
        expl.append(String.format(Locale.US, " | Final score: %.1f%%", finalScore * 100));
        return expl.toString();
    }

    private static void requireInput(Job job, Resume resume) {
        if (job == null) {
            throw new InvalidInputException("Job is required for scoring");
        }
        if (resume == null || resume.getProfile() == null) {
            throw new InvalidInputException("Parsed résumé profile is required for scoring");
        }
    }

    private static double clamp(double v) {
        return Math.max(0, Math.min(1, v));
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
