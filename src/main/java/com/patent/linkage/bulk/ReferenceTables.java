package com.patent.linkage.bulk;

import com.patent.linkage.core.model.IdentifierSet;
import com.patent.linkage.reference.IdentifierAssignment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reference dataset rows and identifier assignments as tables.
 */
public final class ReferenceTables {

    public static final String COMPANY_NAME = "conm";
    public static final String GVKEY = "gvkey";
    public static final String CUSIP = "cusip";
    public static final String CIK = "cik";

    public static final List<String> ASSIGNMENT_COLUMNS = List.of(
            "entity_id", "acquiror_name", GVKEY, CUSIP, CIK, "reference_name", "batch_id");

    private ReferenceTables() {
    }

    /**
     * Reads reference rows. Only the company name column is required; missing
     * identifier columns leave those fields empty.
     */
    public static List<IdentifierSet> fromTable(Table table, String source) {
        table.requireColumns(source, List.of(COMPANY_NAME));
        List<IdentifierSet> rows = new ArrayList<>(table.size());
        for (Map<String, String> row : table.rows()) {
            rows.add(new IdentifierSet(row.get(GVKEY), row.get(CUSIP), row.get(CIK), row.get(COMPANY_NAME)));
        }
        return rows;
    }

    public static Table assignmentsToTable(List<IdentifierAssignment> assignments) {
        Table.Builder builder = Table.builder(ASSIGNMENT_COLUMNS);
        for (IdentifierAssignment a : assignments) {
            IdentifierSet ids = a.identifiers();
            builder.addRow(a.entityId(), a.entityName(), ids.gvkey(), ids.cusip(), ids.cik(),
                    ids.referenceName(), a.batchId());
        }
        return builder.build();
    }

    public static List<IdentifierAssignment> assignmentsFromTable(Table table, String source) {
        table.requireColumns(source, ASSIGNMENT_COLUMNS);
        List<IdentifierAssignment> assignments = new ArrayList<>(table.size());
        for (Map<String, String> row : table.rows()) {
            assignments.add(new IdentifierAssignment(
                    row.get("entity_id"),
                    row.get("acquiror_name"),
                    new IdentifierSet(row.get(GVKEY), row.get(CUSIP), row.get(CIK), emptyToNull(row.get("reference_name"))),
                    emptyToNull(row.get("batch_id"))));
        }
        return assignments;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
