package com.patent.linkage.dictionary;

/**
 * Thrown when a dictionary file cannot be read or written, or fails its
 * consistency check on load.
 */
public class DictionaryPersistenceException extends RuntimeException {

    public DictionaryPersistenceException(String message) {
        super(message);
    }

    public DictionaryPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
