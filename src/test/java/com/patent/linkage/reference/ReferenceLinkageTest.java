package com.patent.linkage.reference;

import com.patent.linkage.core.model.IdentifierSet;
import com.patent.linkage.core.model.MatchCandidate;
import com.patent.linkage.core.model.MatchTier;
import com.patent.linkage.dictionary.CanonicalDictionary;
import com.patent.linkage.dictionary.DictionaryBuilder;
import com.patent.linkage.match.MatchRunResult;
import com.patent.linkage.match.TieredMatcher;
import com.patent.linkage.metrics.MetricsService;
import com.patent.linkage.review.AcceptedMatchSet;
import com.patent.linkage.review.ReviewCollaborator;
import com.patent.linkage.review.ReviewService;
import com.patent.linkage.rules.DefaultNormalizationRules;
import com.patent.linkage.rules.NameNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Reference linkage Tests")
class ReferenceLinkageTest {

    private final NameNormalizer normalizer = DefaultNormalizationRules.createDefaultEngine();
    private CanonicalDictionary dictionary;
    private ReferenceIndex reference;

    @BeforeEach
    void setUp() {
        dictionary = new DictionaryBuilder().build(List.of(new AcceptedMatchSet("aliases", List.of(
                MatchCandidate.strict("Acme Corp", "acme", "Acme Holdings", "acme holdings", "containment"),
                MatchCandidate.strict("Zenith", "zenith", "Zenith Electronics", "zenith electronics", "containment"),
                MatchCandidate.strict("Apex", "apex", "Apex Group", "apex group", "containment"))))).dictionary();
        reference = ReferenceIndex.build(List.of(
                new IdentifierSet("001004", "000361105", "1750", "ACME HOLDINGS INC"),
                new IdentifierSet("009999", null, null, "Acme Holdings Corp"),
                new IdentifierSet("012141", "594918104", "789019", "ZENITH ELECTRONICS CORP"),
                new IdentifierSet("000001", null, null, "   ")), normalizer);
    }

    private AcceptedMatchSet accepted(String batchId, String entityName, String referenceName) {
        return new AcceptedMatchSet(batchId, List.of(MatchCandidate.strict(
                entityName, normalizer.normalize(entityName),
                referenceName, normalizer.normalize(referenceName), "containment")));
    }

    @Nested
    @DisplayName("ReferenceIndex")
    class Index {

        @Test
        @DisplayName("Keeps the first row per key and drops blank names")
        void firstRowWins() {
            assertEquals(2, reference.size());
            assertEquals(2, reference.droppedRows());
            assertEquals("001004", reference.lookup("acme holdings").orElseThrow().gvkey());
            assertEquals(List.of("ACME HOLDINGS INC", "ZENITH ELECTRONICS CORP"), reference.names());
            assertTrue(reference.lookup("apex group").isEmpty());
        }
    }

    @Nested
    @DisplayName("ReferenceMatcher")
    class Matching {

        @Test
        @DisplayName("Matches entity display names against reference names")
        void matchesEntities() {
            ReferenceMatcher matcher = new ReferenceMatcher(new TieredMatcher(normalizer));

            MatchRunResult result = matcher.match(dictionary, reference);

            assertEquals(2, result.candidates().size());
            assertTrue(result.candidates().stream().allMatch(c -> c.tier() == MatchTier.EXACT));
            assertEquals(List.of("Acme Holdings", "Zenith Electronics"),
                    result.candidates().stream().map(MatchCandidate::sourceName).toList());
            assertEquals(1, result.statistics().unmatched());
        }

        @Test
        @DisplayName("Reviewed reference matches feed the identifier merge")
        void endToEnd() {
            ReferenceMatcher matcher = new ReferenceMatcher(new TieredMatcher(normalizer));
            AcceptedMatchSet accepted = new ReviewService().accept("ref-1",
                    matcher.match(dictionary, reference), ReviewCollaborator.acceptAll());

            List<IdentifierAssignment> assignments = new IdentifierMerger()
                    .merge(List.of(), dictionary, reference, List.of(accepted));

            assertEquals(2, assignments.size());
            assertEquals("E000001", assignments.get(0).entityId());
            assertEquals("001004", assignments.get(0).identifiers().gvkey());
            assertEquals("E000002", assignments.get(1).entityId());
            assertEquals("789019", assignments.get(1).identifiers().cik());
        }
    }

    @Nested
    @DisplayName("IdentifierMerger")
    class Merging {

        @Test
        @DisplayName("Fills only empty fields")
        void fillsEmptyFields() {
            IdentifierAssignment partial = new IdentifierAssignment("E000001", "Acme Holdings",
                    new IdentifierSet("001004", null, null, "ACME HOLDINGS INC"), "earlier");
            MetricsService metrics = mock(MetricsService.class);

            List<IdentifierAssignment> result = new IdentifierMerger(metrics).merge(List.of(partial), dictionary,
                    reference, List.of(accepted("ref-2", "Acme Holdings", "ACME HOLDINGS INC")));

            IdentifierSet ids = result.get(0).identifiers();
            assertEquals("001004", ids.gvkey());
            assertEquals("000361105", ids.cusip());
            assertEquals("1750", ids.cik());
            assertEquals("ref-2", result.get(0).batchId());
            verify(metrics, times(1)).incrementIdentifierFilled();
        }

        @Test
        @DisplayName("Re-applying the same identifiers changes nothing")
        void idempotent() {
            IdentifierMerger merger = new IdentifierMerger();
            List<AcceptedMatchSet> batches = List.of(accepted("ref-1", "Acme Holdings", "ACME HOLDINGS INC"));

            List<IdentifierAssignment> first = merger.merge(List.of(), dictionary, reference, batches);
            List<IdentifierAssignment> second = merger.merge(first, dictionary, reference, batches);

            assertEquals(first, second);
        }

        @Test
        @DisplayName("A differing populated identifier aborts the merge")
        void conflict() {
            IdentifierAssignment existing = new IdentifierAssignment("E000001", "Acme Holdings",
                    new IdentifierSet("005555", null, null, "OTHER"), "earlier");

            IdentifierConflictException e = assertThrows(IdentifierConflictException.class,
                    () -> new IdentifierMerger().merge(List.of(existing), dictionary, reference,
                            List.of(accepted("ref-2", "Acme Holdings", "ACME HOLDINGS INC"))));

            assertEquals("E000001", e.getEntityId());
            assertEquals("005555", e.getExisting().gvkey());
            assertEquals("001004", e.getIncoming().gvkey());
            assertEquals("earlier", e.getExistingBatchId());
            assertEquals("ref-2", e.getIncomingBatchId());
        }

        @Test
        @DisplayName("Identifiers from a different reference row abort the merge even without a shared field")
        void differentReferenceRow() {
            ReferenceIndex twoRows = ReferenceIndex.build(List.of(
                    new IdentifierSet("001", null, null, "Acme Holdings"),
                    new IdentifierSet(null, "999", null, "Acme Industries")), normalizer);

            IdentifierConflictException e = assertThrows(IdentifierConflictException.class,
                    () -> new IdentifierMerger().merge(List.of(), dictionary, twoRows, List.of(
                            accepted("r1", "Acme Holdings", "Acme Holdings"),
                            accepted("r2", "Acme Holdings", "Acme Industries"))));

            assertEquals("E000001", e.getEntityId());
            assertEquals("001", e.getExisting().gvkey());
            assertEquals("999", e.getIncoming().cusip());
            assertEquals("r1", e.getExistingBatchId());
            assertEquals("r2", e.getIncomingBatchId());
        }

        @Test
        @DisplayName("An existing assignment without identifiers takes the incoming set")
        void fillsEmptyAssignment() {
            IdentifierAssignment empty = new IdentifierAssignment("E000002", "Zenith Electronics",
                    new IdentifierSet(null, null, null, null), null);

            List<IdentifierAssignment> result = new IdentifierMerger().merge(List.of(empty), dictionary, reference,
                    List.of(accepted("ref-3", "Zenith Electronics", "ZENITH ELECTRONICS CORP")));

            assertEquals(1, result.size());
            assertEquals("012141", result.get(0).identifiers().gvkey());
            assertEquals("ZENITH ELECTRONICS CORP", result.get(0).identifiers().referenceName());
            assertEquals("ref-3", result.get(0).batchId());
        }

        @Test
        @DisplayName("Rows naming unknown entities or references are skipped")
        void skipsUnknown() {
            List<IdentifierAssignment> result = new IdentifierMerger().merge(List.of(), dictionary, reference,
                    List.of(accepted("ref-1", "Unknown Co", "ACME HOLDINGS INC"),
                            accepted("ref-1", "Apex Group", "APEX GROUP PLC")));

            assertTrue(result.isEmpty());
        }
    }
}
