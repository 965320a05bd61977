package com.patent.linkage.match;

import com.patent.linkage.core.model.MatchCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Deterministic rules that link a source key to a target key when they are not
 * equal but are unambiguously the same company.
 *
 * <p>Rules are tried in order:</p>
 * <ol>
 *   <li><b>compact</b> - keys are equal once spaces and hyphens are removed
 *       ("micro soft" / "microsoft")</li>
 *   <li><b>acronym</b> - a single-token key equals the initials of a multi-token
 *       key, in either direction ("ibm" / "international business machines")</li>
 *   <li><b>containment</b> - one key's tokens appear as a contiguous run inside
 *       the other's, and the contained key is long enough to be distinctive</li>
 * </ol>
 *
 * <p>A rule that points at more than one distinct target is ambiguous and is
 * skipped. Strict-rule candidates always score 100 and are auto-accepted.</p>
 */
public class StrictRuleMatcher {

    private static final Logger log = LoggerFactory.getLogger(StrictRuleMatcher.class);

    public static final String RULE_COMPACT = "compact";
    public static final String RULE_ACRONYM = "acronym";
    public static final String RULE_CONTAINMENT = "containment";

    static final int MIN_ACRONYM_LENGTH = 3;

    private final int minContainmentLength;

    public StrictRuleMatcher(int minContainmentLength) {
        if (minContainmentLength <= 0) {
            throw new IllegalArgumentException("minContainmentLength must be positive");
        }
        this.minContainmentLength = minContainmentLength;
    }

    public StrictRuleMatcher() {
        this(MatchOptions.DEFAULT_MIN_CONTAINMENT_LENGTH);
    }

    /**
     * Applies the rules in order and returns the first unambiguous link.
     */
    public Optional<MatchCandidate> match(String sourceName, String sourceKey, TargetIndex targets) {
        if (sourceKey == null || sourceKey.isEmpty()) {
            return Optional.empty();
        }

        Optional<MatchCandidate> result = unique(sourceName, sourceKey, compactMatches(sourceKey, targets),
                RULE_COMPACT, targets);
        if (result.isEmpty()) {
            result = unique(sourceName, sourceKey, acronymMatches(sourceKey, targets), RULE_ACRONYM, targets);
        }
        if (result.isEmpty()) {
            result = unique(sourceName, sourceKey, containmentMatches(sourceKey, targets),
                    RULE_CONTAINMENT, targets);
        }
        return result;
    }

    Set<String> compactMatches(String sourceKey, TargetIndex targets) {
        Set<String> matches = new TreeSet<>(targets.keysWithCompactForm(TargetIndex.compactForm(sourceKey)));
        matches.remove(sourceKey);
        return matches;
    }

    Set<String> acronymMatches(String sourceKey, TargetIndex targets) {
        Set<String> matches = new TreeSet<>();
        List<String> tokens = TargetIndex.tokens(sourceKey);
        if (tokens.size() == 1) {
            if (sourceKey.length() >= MIN_ACRONYM_LENGTH) {
                matches.addAll(targets.keysWithInitials(sourceKey));
            }
        } else {
            String initials = TargetIndex.initialsOf(tokens);
            if (initials.length() >= MIN_ACRONYM_LENGTH && targets.contains(initials)) {
                matches.add(initials);
            }
        }
        return matches;
    }

    Set<String> containmentMatches(String sourceKey, TargetIndex targets) {
        Set<String> matches = new TreeSet<>();
        List<String> tokens = TargetIndex.tokens(sourceKey);

        // target inside source: every proper contiguous run of source tokens
        for (int from = 0; from < tokens.size(); from++) {
            for (int to = from + 1; to <= tokens.size(); to++) {
                if (from == 0 && to == tokens.size()) {
                    continue;
                }
                String run = String.join(" ", tokens.subList(from, to));
                if (run.length() >= minContainmentLength && targets.contains(run)) {
                    matches.add(run);
                }
            }
        }

        // source inside target
        if (sourceKey.length() >= minContainmentLength && !tokens.isEmpty()) {
            String padded = " " + sourceKey + " ";
            for (String candidate : targets.keysWithToken(tokens.get(0))) {
                if (!candidate.equals(sourceKey) && (" " + candidate + " ").contains(padded)) {
                    matches.add(candidate);
                }
            }
        }
        return matches;
    }

    private Optional<MatchCandidate> unique(String sourceName, String sourceKey, Set<String> matches,
                                            String rule, TargetIndex targets) {
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        if (matches.size() > 1) {
            log.debug("strict.ambiguous rule={} source='{}' targets={}", rule, sourceName, matches);
            return Optional.empty();
        }
        String targetKey = matches.iterator().next();
        return Optional.of(MatchCandidate.strict(sourceName, sourceKey,
                targets.representative(targetKey), targetKey, rule));
    }
}
