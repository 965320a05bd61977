package com.patent.linkage.bulk;

import com.patent.linkage.core.model.MatchCandidate;
import com.patent.linkage.core.model.MatchDecision;
import com.patent.linkage.core.model.MatchTier;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts match candidates to and from the review-file layout.
 *
 * <pre>
 * source_name,source_key,target_name,target_key,tier,score,decision,rule
 * Acme Labs,acme labs,Acme Laboratories,acme laboratories,FUZZY,86.6667,NEEDS_REVIEW,TokenSet
 * </pre>
 *
 * <p>Scores are written in their shortest exact decimal form, so a file read
 * back yields candidates equal to the ones written.</p>
 */
public final class MatchCandidateTables {

    public static final List<String> COLUMNS = List.of(
            "source_name", "source_key", "target_name", "target_key", "tier", "score", "decision", "rule");

    private MatchCandidateTables() {
    }

    public static Table toTable(List<MatchCandidate> candidates) {
        Table.Builder builder = Table.builder(COLUMNS);
        for (MatchCandidate c : candidates) {
            builder.addRow(c.sourceName(), c.sourceKey(), c.targetName(), c.targetKey(),
                    c.tier().name(), formatScore(c.score()), c.decision().name(), c.rule());
        }
        return builder.build();
    }

    /**
     * Reads candidates back, e.g. from a review file the reviewer has pruned.
     *
     * @throws InputSchemaException if a column is missing or a cell is malformed
     */
    public static List<MatchCandidate> fromTable(Table table, String source) {
        table.requireColumns(source, COLUMNS);
        List<MatchCandidate> candidates = new ArrayList<>(table.size());
        int rowNumber = 1;
        for (Map<String, String> row : table.rows()) {
            rowNumber++;
            try {
                candidates.add(new MatchCandidate(
                        row.get("source_name"),
                        row.get("source_key"),
                        row.get("target_name"),
                        row.get("target_key"),
                        MatchTier.valueOf(row.get("tier").trim()),
                        Double.parseDouble(row.get("score").trim()),
                        MatchDecision.valueOf(row.get("decision").trim()),
                        row.get("rule")));
            } catch (IllegalArgumentException e) {
                throw new InputSchemaException(source, "malformed candidate at row " + rowNumber +
                        ": " + e.getMessage(), e);
            }
        }
        return candidates;
    }

    static String formatScore(double score) {
        return BigDecimal.valueOf(score).stripTrailingZeros().toPlainString();
    }
}
