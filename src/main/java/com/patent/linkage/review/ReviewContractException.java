package com.patent.linkage.review;

/**
 * Thrown when a reviewer returns rows it was not offered, or returns them reordered.
 */
public class ReviewContractException extends RuntimeException {

    public ReviewContractException(String message) {
        super(message);
    }

    public ReviewContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
