package com.patent.linkage.bulk;

import com.patent.linkage.core.model.FactRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads patent records from the patent table.
 *
 * <p>Required columns: {@code assignee}, {@code application_year}. Optional:
 * {@code inventors} (declared inventor count) and any number of
 * {@code inventor_name<n>} columns. Rows with a non-numeric year are skipped
 * and counted; a non-numeric inventor count is treated as absent.</p>
 */
public final class FactRecordTables {
    private static final Logger log = LoggerFactory.getLogger(FactRecordTables.class);

    public static final String ASSIGNEE = "assignee";
    public static final String APPLICATION_YEAR = "application_year";
    public static final String INVENTORS = "inventors";
    private static final Pattern INVENTOR_NAME = Pattern.compile("inventor_name(\\d+)");

    private FactRecordTables() {
    }

    public static List<FactRecord> fromTable(Table table, String source) {
        table.requireColumns(source, List.of(ASSIGNEE, APPLICATION_YEAR));
        List<String> inventorColumns = inventorNameColumns(table.columns());
        boolean hasDeclared = table.hasColumn(INVENTORS);

        List<FactRecord> facts = new ArrayList<>(table.size());
        long badYear = 0;
        for (Map<String, String> row : table.rows()) {
            Integer year = parseYear(row.get(APPLICATION_YEAR));
            if (year == null) {
                badYear++;
                continue;
            }
            List<String> inventors = new ArrayList<>();
            for (String column : inventorColumns) {
                String value = row.get(column);
                if (value != null && !value.isBlank()) {
                    inventors.add(value.trim());
                }
            }
            Integer declared = hasDeclared ? parseCount(row.get(INVENTORS)) : null;
            facts.add(new FactRecord(row.get(ASSIGNEE), year, inventors, declared));
        }
        if (badYear > 0) {
            log.warn("facts.skipped source={} invalidYear={}", source, badYear);
        }
        log.info("facts.read source={} records={} inventorColumns={}", source, facts.size(), inventorColumns.size());
        return facts;
    }

    static List<String> inventorNameColumns(List<String> columns) {
        return columns.stream()
                .filter(c -> INVENTOR_NAME.matcher(c).matches())
                .sorted(Comparator.comparingInt(FactRecordTables::inventorIndex))
                .toList();
    }

    private static int inventorIndex(String column) {
        Matcher m = INVENTOR_NAME.matcher(column);
        return m.matches() ? Integer.parseInt(m.group(1)) : Integer.MAX_VALUE;
    }

    /**
     * Parses a year cell; accepts "2015" and "2015.0". Null if not a whole number.
     */
    static Integer parseYear(String cell) {
        Double value = parseNumber(cell);
        if (value == null || value != Math.floor(value)) {
            return null;
        }
        return value.intValue();
    }

    static Integer parseCount(String cell) {
        Double value = parseNumber(cell);
        if (value == null || value < 0) {
            return null;
        }
        return (int) Math.floor(value);
    }

    private static Double parseNumber(String cell) {
        if (cell == null || cell.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(cell.trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
