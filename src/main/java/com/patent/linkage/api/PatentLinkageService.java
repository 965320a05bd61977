package com.patent.linkage.api;

import com.patent.linkage.aggregate.AggregationResult;
import com.patent.linkage.aggregate.FactAggregator;
import com.patent.linkage.cache.CacheStats;
import com.patent.linkage.cache.CachingNameNormalizer;
import com.patent.linkage.core.model.FactRecord;
import com.patent.linkage.core.model.IdentifierSet;
import com.patent.linkage.dictionary.BuildResult;
import com.patent.linkage.dictionary.CanonicalDictionary;
import com.patent.linkage.dictionary.DictionaryBuilder;
import com.patent.linkage.dictionary.DictionaryStore;
import com.patent.linkage.match.MatchQualityCheck;
import com.patent.linkage.match.MatchRunResult;
import com.patent.linkage.match.SourceStratifier;
import com.patent.linkage.match.TieredMatcher;
import com.patent.linkage.metrics.MetricsService;
import com.patent.linkage.metrics.NoOpMetricsService;
import com.patent.linkage.reference.IdentifierAssignment;
import com.patent.linkage.reference.IdentifierMerger;
import com.patent.linkage.reference.ReferenceIndex;
import com.patent.linkage.reference.ReferenceMatcher;
import com.patent.linkage.review.AcceptedMatchSet;
import com.patent.linkage.review.ReviewCollaborator;
import com.patent.linkage.review.ReviewService;
import com.patent.linkage.rules.DefaultNormalizationRules;
import com.patent.linkage.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point wiring the linkage stages together.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * PatentLinkageService linkage = PatentLinkageService.builder()
 *     .config(LinkageConfig.load("linkage.properties"))
 *     .build();
 *
 * MatchRunResult matches = linkage.matchAliases(assignees, acquirors);
 * AcceptedMatchSet batch = linkage.review("2024-q1", matches, reviewer);
 * BuildResult built = linkage.buildDictionary(linkage.loadDictionary(dictionaryFile), List.of(batch));
 * linkage.saveDictionary(built.dictionary(), dictionaryFile);
 *
 * AggregationResult activity = linkage.aggregate(built.dictionary(), patents);
 * </pre>
 */
public class PatentLinkageService {
    private static final Logger log = LoggerFactory.getLogger(PatentLinkageService.class);

    private final LinkageConfig config;
    private final NameNormalizer normalizer;
    private final MetricsService metricsService;
    private final TieredMatcher matcher;
    private final SourceStratifier stratifier;
    private final MatchQualityCheck qualityCheck;
    private final ReviewService reviewService;
    private final DictionaryBuilder dictionaryBuilder;
    private final DictionaryStore dictionaryStore;
    private final FactAggregator aggregator;
    private final ReferenceMatcher referenceMatcher;
    private final IdentifierMerger identifierMerger;

    private PatentLinkageService(Builder builder) {
        this.config = builder.config != null ? builder.config : LinkageConfig.defaults();
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        NameNormalizer base = builder.normalizer != null
                ? builder.normalizer : DefaultNormalizationRules.createDefaultEngine();
        this.normalizer = CachingNameNormalizer.create(base, config.getCacheConfig(), metricsService);

        this.matcher = new TieredMatcher(normalizer, config.getMatchOptions(), metricsService);
        this.stratifier = builder.stratifier != null ? builder.stratifier : new SourceStratifier();
        this.qualityCheck = new MatchQualityCheck();
        this.reviewService = new ReviewService();
        this.dictionaryBuilder = new DictionaryBuilder(metricsService);
        this.dictionaryStore = new DictionaryStore();
        this.aggregator = new FactAggregator(normalizer, metricsService);
        this.referenceMatcher = new ReferenceMatcher(matcher, config.getReferenceOptions());
        this.identifierMerger = new IdentifierMerger(metricsService);

        log.info("linkage.initialized match={} reference={} cache={}",
                config.getMatchOptions(), config.getReferenceOptions(), config.getCacheConfig());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Matches source names (e.g. patent assignees) to target names (e.g. acquirors).
     */
    public MatchRunResult matchAliases(List<String> sources, List<String> targets) {
        return matcher.match(sources, targets, config.getMatchOptions());
    }

    /**
     * Matches sources stratified by patent volume.
     */
    public MatchRunResult matchByVolume(List<SourceStratifier.SourceVolume> sources, List<String> targets) {
        return matcher.matchStrata(stratifier.stratify(sources, config.getMatchOptions()), targets);
    }

    public MatchQualityCheck.QualityReport checkQuality(MatchRunResult result) {
        return qualityCheck.check(result.candidates());
    }

    public AcceptedMatchSet review(String batchId, MatchRunResult result, ReviewCollaborator reviewer) {
        return reviewService.accept(batchId, result, reviewer);
    }

    public BuildResult buildDictionary(List<AcceptedMatchSet> batches) {
        return dictionaryBuilder.build(batches);
    }

    public BuildResult buildDictionary(CanonicalDictionary existing, List<AcceptedMatchSet> batches) {
        return dictionaryBuilder.build(existing, batches);
    }

    public CanonicalDictionary loadDictionary(Path file) {
        return dictionaryStore.loadOrEmpty(file);
    }

    public void saveDictionary(CanonicalDictionary dictionary, Path file) {
        dictionaryStore.save(dictionary, file);
    }

    public AggregationResult aggregate(CanonicalDictionary dictionary, List<FactRecord> facts) {
        return aggregator.aggregate(dictionary, facts);
    }

    public ReferenceIndex referenceIndex(List<IdentifierSet> referenceRows) {
        return ReferenceIndex.build(referenceRows, normalizer);
    }

    /**
     * Matches every dictionary entity against the reference names.
     */
    public MatchRunResult matchReference(CanonicalDictionary dictionary, ReferenceIndex reference) {
        return referenceMatcher.match(dictionary, reference);
    }

    /**
     * Fills reference identifiers from reviewed reference batches.
     *
     * @throws com.patent.linkage.reference.IdentifierConflictException on any disagreeing identifier
     */
    public List<IdentifierAssignment> mergeIdentifiers(List<IdentifierAssignment> existing,
                                                       CanonicalDictionary dictionary,
                                                       ReferenceIndex reference,
                                                       List<AcceptedMatchSet> reviewedBatches) {
        return identifierMerger.merge(existing, dictionary, reference, reviewedBatches);
    }

    public NameNormalizer getNormalizer() {
        return normalizer;
    }

    public LinkageConfig getConfig() {
        return config;
    }

    public CacheStats getCacheStats() {
        return normalizer instanceof CachingNameNormalizer caching ? caching.getStats() : CacheStats.empty();
    }

    public static class Builder {
        private LinkageConfig config;
        private NameNormalizer normalizer;
        private MetricsService metricsService;
        private SourceStratifier stratifier;

        public Builder config(LinkageConfig config) {
            this.config = config;
            return this;
        }

        public Builder normalizer(NameNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder stratifier(SourceStratifier stratifier) {
            this.stratifier = stratifier;
            return this;
        }

        public PatentLinkageService build() {
            return new PatentLinkageService(this);
        }
    }
}
