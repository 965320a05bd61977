package com.patent.linkage.match;

/**
 * Thrown when a fuzzy scoring chunk fails and its sequential retry fails too.
 * Identifies the chunk by index and by its first and last source names.
 */
public class WorkerExecutionException extends RuntimeException {

    private final int chunkIndex;
    private final String firstSource;
    private final String lastSource;

    public WorkerExecutionException(int chunkIndex, String firstSource, String lastSource, Throwable cause) {
        super("Fuzzy scoring failed for chunk " + chunkIndex +
                " (sources '" + firstSource + "' .. '" + lastSource + "'): " +
                (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.chunkIndex = chunkIndex;
        this.firstSource = firstSource;
        this.lastSource = lastSource;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public String getFirstSource() {
        return firstSource;
    }

    public String getLastSource() {
        return lastSource;
    }
}
