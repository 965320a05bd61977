package com.patent.linkage.bulk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a CSV file into a {@link Table}.
 *
 * <p>The first record is the header. Fields may be quoted; a quoted field can
 * contain commas, doubled quotes and line breaks. Cells are kept as strings,
 * so identifier columns keep their leading zeros. Blank lines are skipped and
 * short records are padded with empty cells.</p>
 */
public class CsvTableReader {
    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

    private static final char BOM = '\uFEFF';

    public Table read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    public Table read(Reader reader, String source) throws IOException {
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        List<String> header = readRecord(br);
        if (header == null) {
            throw new InputSchemaException(source, "file is empty, header row expected", null);
        }
        if (!header.isEmpty() && !header.get(0).isEmpty() && header.get(0).charAt(0) == BOM) {
            header.set(0, header.get(0).substring(1));
        }
        header.replaceAll(String::trim);

        Table.Builder builder;
        try {
            builder = Table.builder(header);
        } catch (IllegalArgumentException e) {
            throw new InputSchemaException(source, e.getMessage(), e);
        }

        long recordNumber = 1;
        long oversized = 0;
        List<String> record;
        while ((record = readRecord(br)) != null) {
            recordNumber++;
            if (record.size() == 1 && record.get(0).isEmpty()) {
                continue;
            }
            if (record.size() > header.size()) {
                oversized++;
                log.debug("csv.record.oversized source={} record={} fields={} columns={}",
                        source, recordNumber, record.size(), header.size());
                record = record.subList(0, header.size());
            }
            while (record.size() < header.size()) {
                record.add("");
            }
            builder.addRow(record.toArray());
        }

        Table table = builder.build();
        if (oversized > 0) {
            log.warn("csv.read source={} oversizedRecords={} (extra fields dropped)", source, oversized);
        }
        log.debug("csv.read source={} columns={} rows={}", source, header.size(), table.size());
        return table;
    }

    /**
     * Reads one logical record; null at end of input.
     */
    static List<String> readRecord(BufferedReader br) throws IOException {
        int c = br.read();
        if (c == -1) {
            return null;
        }
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        while (c != -1) {
            char ch = (char) c;
            if (quoted) {
                if (ch == '"') {
                    br.mark(1);
                    int next = br.read();
                    if (next == '"') {
                        field.append('"');
                    } else {
                        quoted = false;
                        if (next != -1) {
                            br.reset();
                        }
                    }
                } else {
                    field.append(ch);
                }
            } else if (ch == '"' && field.length() == 0) {
                quoted = true;
            } else if (ch == ',') {
                fields.add(field.toString());
                field.setLength(0);
            } else if (ch == '\n') {
                break;
            } else if (ch == '\r') {
                br.mark(1);
                if (br.read() != '\n') {
                    br.reset();
                }
                break;
            } else {
                field.append(ch);
            }
            c = br.read();
        }
        fields.add(field.toString());
        return fields;
    }
}
