package com.patent.linkage.bulk;

import java.util.List;

/**
 * Thrown when an input table lacks columns its stage requires.
 * Raised before any row is processed.
 */
public class InputSchemaException extends RuntimeException {

    private final String source;
    private final List<String> missingColumns;

    public InputSchemaException(String source, List<String> missingColumns) {
        super("Input " + source + " is missing required column(s) " + missingColumns);
        this.source = source;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public InputSchemaException(String source, String message, Throwable cause) {
        super("Input " + source + ": " + message, cause);
        this.source = source;
        this.missingColumns = List.of();
    }

    public String getSource() {
        return source;
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
