package com.patent.linkage.bulk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link Table} as CSV with a header row.
 */
public class CsvTableWriter {
    private static final Logger log = LoggerFactory.getLogger(CsvTableWriter.class);

    public void write(Table table, Path file) {
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                write(table, writer);
            }
            log.info("csv.written path={} rows={}", file, table.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    public void write(Table table, Writer writer) throws IOException {
        PrintWriter pw = new PrintWriter(writer);
        pw.print(joinLine(table.columns()));
        pw.print('\n');
        for (Map<String, String> row : table.rows()) {
            pw.print(joinLine(table.columns().stream().map(row::get).toList()));
            pw.print('\n');
        }
        pw.flush();
        if (pw.checkError()) {
            throw new IOException("CSV write failed");
        }
    }

    private String joinLine(List<String> values) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(csvEscape(values.get(i)));
        }
        return sb.toString();
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
