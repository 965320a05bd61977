package com.patent.linkage.core.model;

import java.util.Objects;

/**
 * Identifier fields taken from the financial reference dataset.
 * Values are kept as strings so leading zeros survive.
 *
 * @param gvkey         reference company key
 * @param cusip         CUSIP
 * @param cik           SEC central index key
 * @param referenceName company name as recorded in the reference dataset
 */
public record IdentifierSet(String gvkey, String cusip, String cik, String referenceName) {

    public IdentifierSet {
        gvkey = blankToNull(gvkey);
        cusip = blankToNull(cusip);
        cik = blankToNull(cik);
    }

    /**
     * Compares the identifier fields only; the reference name is informational.
     */
    public boolean sameIdentifiers(IdentifierSet other) {
        return other != null
                && Objects.equals(gvkey, other.gvkey)
                && Objects.equals(cusip, other.cusip)
                && Objects.equals(cik, other.cik);
    }

    public boolean isEmpty() {
        return gvkey == null && cusip == null && cik == null;
    }

    @Override
    public String toString() {
        return "IdentifierSet{gvkey=" + gvkey + ", cusip=" + cusip + ", cik=" + cik +
                ", referenceName='" + referenceName + "'}";
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
