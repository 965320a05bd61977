package com.patent.linkage.dictionary;

import com.patent.linkage.core.model.MatchCandidate;
import com.patent.linkage.match.TieredMatcher;
import com.patent.linkage.metrics.MetricsService;
import com.patent.linkage.review.AcceptedMatchSet;
import com.patent.linkage.rules.DefaultNormalizationRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DictionaryBuilder Tests")
class DictionaryBuilderTest {

    @Mock
    private MetricsService metrics;

    private DictionaryBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new DictionaryBuilder(metrics);
    }

    private static MatchCandidate link(String raw, String key, String target) {
        return MatchCandidate.strict(raw, key, target, target.trim().toLowerCase(), "containment");
    }

    private static AcceptedMatchSet batch(String id, MatchCandidate... candidates) {
        return new AcceptedMatchSet(id, List.of(candidates));
    }

    @Nested
    @DisplayName("Building")
    class Building {

        @Test
        @DisplayName("Should map every alias key to one entity")
        void mapsAliases() {
            BuildResult result = builder.build(List.of(batch("b1",
                    link("Acme Corp", "acme", "Acme Holdings"),
                    link("ACME Widgets", "acme widgets", "Acme Holdings"),
                    link("Zenith Labs", "zenith labs", " Zenith Electronics "))));

            CanonicalDictionary dictionary = result.dictionary();
            assertEquals(3, dictionary.aliasCount());
            assertEquals(2, dictionary.entityCount());
            assertEquals("E000001", dictionary.resolve("acme").orElseThrow());
            assertEquals("E000001", dictionary.resolve("acme widgets").orElseThrow());
            assertEquals("E000002", dictionary.resolve("zenith labs").orElseThrow());
            assertEquals("Zenith Electronics", dictionary.entity("E000002").orElseThrow().displayName());
            assertEquals(List.of("ACME Widgets", "Acme Corp"),
                    dictionary.entity("E000001").orElseThrow().rawAliases());
            assertFalse(result.hasConflicts());
            assertTrue(dictionary.resolve("unknown").isEmpty());
            assertTrue(dictionary.resolve(null).isEmpty());
        }

        @Test
        @DisplayName("Should skip rows with a blank key or target")
        void skipsBlankRows() {
            BuildResult result = builder.build(List.of(batch("b1",
                    link("Acme Corp", "acme", "Acme Holdings"),
                    link("???", "", "Acme Holdings"),
                    MatchCandidate.strict("Apex", "apex", "   ", "", "compact"))));

            assertEquals(1, result.dictionary().aliasCount());
            assertEquals(2, result.statistics().skippedRows());
        }

        @Test
        @DisplayName("Should record per-batch contributions")
        void contributions() {
            BuildResult result = builder.build(List.of(
                    batch("b1", link("Acme Corp", "acme", "Acme Holdings")),
                    batch("b2", link("ACME INC", "acme", "Acme Holdings"),
                            link("Apex", "apex", "Apex Group"))));

            List<BatchContribution> contributions = result.statistics().contributions();
            assertEquals(new BatchContribution("b1", 1, 1, 0, 0), contributions.get(0));
            assertEquals(new BatchContribution("b2", 2, 1, 1, 0), contributions.get(1));
            assertEquals(List.of("b1", "b2"), result.statistics().appliedBatches());
            assertEquals(List.of("ACME INC", "Acme Corp"),
                    List.copyOf(result.dictionary().rawAliases("acme")));
        }

        @Test
        @DisplayName("Empty input yields an empty dictionary")
        void emptyInput() {
            BuildResult result = builder.build(List.of());

            assertEquals(0, result.dictionary().aliasCount());
            assertTrue(result.dictionary().entities().isEmpty());
        }
    }

    @Nested
    @DisplayName("Conflicts")
    class Conflicts {

        @Test
        @DisplayName("The most recent batch wins and the earlier mapping is kept in a conflict record")
        void mostRecentWins() {
            BuildResult result = builder.build(List.of(
                    batch("2019", link("Acme Corp", "acme", "Acme Holdings")),
                    batch("2021", link("ACME", "acme", "Apex Group"))));

            CanonicalDictionary dictionary = result.dictionary();
            assertEquals("E000002", dictionary.resolve("acme").orElseThrow());
            assertEquals(1, result.conflicts().size());

            ConflictRecord conflict = result.conflicts().get(0);
            assertEquals("acme", conflict.aliasKey());
            assertEquals("E000001", conflict.previousEntityId());
            assertEquals("Acme Holdings", conflict.previousEntityName());
            assertEquals("2019", conflict.previousBatchId());
            assertEquals("E000002", conflict.newEntityId());
            assertEquals("2021", conflict.newBatchId());
            assertEquals(ConflictRecord.Resolution.MOST_RECENT_WINS, conflict.resolution());

            assertEquals(List.of("ACME"), List.copyOf(dictionary.rawAliases("acme")));
            assertTrue(dictionary.entity("E000001").isEmpty());
            assertEquals("2021", dictionary.provenance("acme").orElseThrow().batchId());
            verify(metrics, times(1)).incrementConflict();
        }

        @Test
        @DisplayName("Every alias stays resolvable after conflicts")
        void conservation() {
            BuildResult result = builder.build(List.of(
                    batch("b1", link("A", "alpha", "One"), link("B", "beta", "One")),
                    batch("b2", link("A2", "alpha", "Two"), link("G", "gamma", "Two")),
                    batch("b3", link("B3", "beta", "Three"), link("A3", "alpha", "One"))));

            CanonicalDictionary dictionary = result.dictionary();
            assertEquals(3, dictionary.aliasCount());
            for (String key : List.of("alpha", "beta", "gamma")) {
                assertTrue(dictionary.resolve(key).isPresent(), key);
            }
            assertEquals("E000001", dictionary.resolve("alpha").orElseThrow());
            assertEquals("E000003", dictionary.resolve("beta").orElseThrow());
            assertEquals(3, result.conflicts().size());
        }

        @Test
        @DisplayName("Target names that normalize alike are one entity across batches")
        void targetSpellingsShareEntity() {
            TieredMatcher matcher = new TieredMatcher(DefaultNormalizationRules.createDefaultEngine());

            BuildResult result = builder.build(List.of(
                    new AcceptedMatchSet("b1", matcher.match(List.of("Acme Co."), List.of("Acme Corp")).candidates()),
                    new AcceptedMatchSet("b2", matcher.match(List.of("Acme Co."), List.of("ACME INC")).candidates())));

            CanonicalDictionary dictionary = result.dictionary();
            assertFalse(result.hasConflicts());
            assertEquals(Map.of("acme", "E000001"), dictionary.entityRegistry());
            assertEquals("E000001", dictionary.resolve("acme").orElseThrow());
            assertEquals("Acme Corp", dictionary.entity("E000001").orElseThrow().displayName());
            assertEquals(List.of("b1", "b2"), dictionary.entity("E000001").orElseThrow().batches());
            verify(metrics, never()).incrementConflict();
        }

        @Test
        @DisplayName("Rebuilding does not report known conflicts again")
        void knownConflictsNotNew() {
            BuildResult first = builder.build(List.of(
                    batch("b1", link("Acme Corp", "acme", "Acme Holdings")),
                    batch("b2", link("ACME", "acme", "Apex Group"))));

            BuildResult second = builder.build(first.dictionary(), List.of(
                    batch("b3", link("Zenith", "zenith", "Zenith Electronics"))));

            assertEquals(1, second.conflicts().size());
            assertTrue(second.newConflicts().isEmpty());
            verify(metrics, times(1)).incrementConflict();
        }
    }

    @Nested
    @DisplayName("Rebuilding")
    class Rebuilding {

        @Test
        @DisplayName("Re-applying the same batch leaves the dictionary unchanged")
        void idempotent() {
            List<AcceptedMatchSet> batches = List.of(
                    batch("b1", link("Acme Corp", "acme", "Acme Holdings")),
                    batch("b2", link("Apex", "apex", "Apex Group")));
            CanonicalDictionary first = builder.build(batches).dictionary();

            BuildResult again = builder.build(first, batches);

            assertEquals(first, again.dictionary());
            assertEquals(List.of("b1", "b2"), again.statistics().unchangedBatches());
            assertTrue(again.statistics().appliedBatches().isEmpty());
        }

        @Test
        @DisplayName("A changed batch replaces its earlier revision in place")
        void replacesBatch() {
            CanonicalDictionary first = builder.build(List.of(
                    batch("b1", link("Acme Corp", "acme", "Acme Holdings")),
                    batch("b2", link("Acme Corp", "acme", "Apex Group")))).dictionary();

            BuildResult rebuilt = builder.build(first, List.of(
                    batch("b1", link("Acme Corp", "acme", "Zenith Electronics"))));

            assertEquals(List.of("b1"), rebuilt.statistics().replacedBatches());
            assertEquals(List.of("b1", "b2"), List.copyOf(rebuilt.dictionary().ledger().batchIds()));
            // b2 still comes later in the ledger
            assertEquals("E000002", rebuilt.dictionary().resolve("acme").orElseThrow());
        }

        @Test
        @DisplayName("Entity ids are stable across rebuilds")
        void stableIds() {
            CanonicalDictionary first = builder.build(List.of(
                    batch("b1", link("Acme Corp", "acme", "Acme Holdings"),
                            link("Apex", "apex", "Apex Group")))).dictionary();

            CanonicalDictionary second = builder.build(first, List.of(
                    batch("b2", link("Zenith", "zenith", "Zenith Electronics"),
                            link("Apex Grp", "apex grp", "Apex Group")))).dictionary();

            assertEquals(Map.of("acme holdings", "E000001", "apex group", "E000002",
                    "zenith electronics", "E000003"), second.entityRegistry());
            assertEquals("E000002", second.resolve("apex grp").orElseThrow());
        }
    }
}
