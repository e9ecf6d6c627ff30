package ru.javaboys.huntymatch.scoring;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Fuzzy skill overlap: a job skill counts as covered when a résumé skill contains it
 * or is contained in it. "java" therefore covers "javascript"; scores depend on that.
 */
public final class SkillOverlapScorer {

    private SkillOverlapScorer() {
    }

    public static SkillOverlap overlap(Collection<String> jobSkills, Collection<String> resumeSkills) {
        // normalized -> first original spelling
        Map<String, String> job = normalizeMap(jobSkills);
        Set<String> got = normalizeSet(resumeSkills);

        List<String> matches = new ArrayList<>();
        for (Map.Entry<String, String> e : job.entrySet()) {
            String skill = e.getKey();
            for (String s : got) {
                if (s.contains(skill) || skill.contains(s)) {
                    matches.add(e.getValue());
                    break;
                }
            }
        }
        double score = (double) matches.size() / Math.max(job.size(), 1);
        return new SkillOverlap(List.copyOf(matches), score);
    }

    static Set<String> normalizeSet(Collection<String> list) {
        Set<String> set = new LinkedHashSet<>();
        if (list != null) {
            for (String s : list) {
                if (StringUtils.isNotBlank(s)) set.add(normalize(s));
            }
        }
        return set;
    }

    private static Map<String, String> normalizeMap(Collection<String> list) {
        Map<String, String> map = new LinkedHashMap<>();
        if (list != null) {
            for (String s : list) {
                if (StringUtils.isNotBlank(s)) map.putIfAbsent(normalize(s), s.trim());
            }
        }
        return map;
    }

    static String normalize(String s) {
        return s.toLowerCase(Locale.ROOT).trim();
    }
}
