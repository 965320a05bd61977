package com.patent.linkage.aggregate;

import com.patent.linkage.core.model.FactRecord;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Inventor measures over a group of patent records.
 */
public final class InventorCounting {

    private InventorCounting() {
    }

    /**
     * Distinct non-blank inventor identifiers, compared after trimming.
     */
    public static Set<String> distinctInventors(Collection<FactRecord> facts) {
        Set<String> inventors = new HashSet<>();
        for (FactRecord fact : facts) {
            for (String id : fact.inventorIds()) {
                if (id != null && !id.isBlank()) {
                    inventors.add(id.trim());
                }
            }
        }
        return inventors;
    }

    /**
     * Sum of {@link FactRecord#effectiveInventorCount()} over the records.
     */
    public static long inventorSum(Collection<FactRecord> facts) {
        long sum = 0;
        for (FactRecord fact : facts) {
            sum += fact.effectiveInventorCount();
        }
        return sum;
    }
}
