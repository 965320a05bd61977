package com.patent.linkage.reference;

import com.patent.linkage.dictionary.CanonicalDictionary;
import com.patent.linkage.dictionary.CanonicalEntity;
import com.patent.linkage.match.MatchOptions;
import com.patent.linkage.match.MatchRunResult;
import com.patent.linkage.match.TieredMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Matches canonical entity names against a reference dataset's company names,
 * using the same tiered matcher as the alias stage.
 */
public class ReferenceMatcher {
    private static final Logger log = LoggerFactory.getLogger(ReferenceMatcher.class);

    private final TieredMatcher matcher;
    private final MatchOptions options;

    public ReferenceMatcher(TieredMatcher matcher) {
        this(matcher, MatchOptions.defaults());
    }

    public ReferenceMatcher(TieredMatcher matcher, MatchOptions options) {
        this.matcher = matcher;
        this.options = options;
    }

    /**
     * Matches every entity of the dictionary by display name.
     */
    public MatchRunResult match(CanonicalDictionary dictionary, ReferenceIndex reference) {
        List<String> entityNames = dictionary.entities().stream()
                .map(CanonicalEntity::displayName)
                .toList();
        return match(entityNames, reference);
    }

    public MatchRunResult match(List<String> entityNames, ReferenceIndex reference) {
        log.info("reference.match.started entities={} referenceNames={}", entityNames.size(), reference.size());
        MatchRunResult result = matcher.match(entityNames, reference.names(), options);
        log.info("reference.match.completed stats={}", result.statistics());
        return result;
    }

    public MatchOptions getOptions() {
        return options;
    }
}
