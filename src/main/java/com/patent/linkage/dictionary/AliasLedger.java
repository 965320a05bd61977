package com.patent.linkage.dictionary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, ordered log of alias assertions grouped by batch.
 *
 * <p>The current alias mapping is never stored directly; it is derived by
 * replaying the ledger in order. Appending a batch or replacing one revision
 * of a batch returns a new ledger with assertions renumbered.</p>
 */
public final class AliasLedger {

    private final List<AliasAssertion> assertions;

    private AliasLedger(List<AliasAssertion> assertions) {
        this.assertions = List.copyOf(assertions);
    }

    public static AliasLedger empty() {
        return new AliasLedger(List.of());
    }

    /**
     * Restores a ledger from persisted assertions, which must be numbered 0..n-1.
     */
    public static AliasLedger of(List<AliasAssertion> assertions) {
        for (int i = 0; i < assertions.size(); i++) {
            if (assertions.get(i).sequence() != i) {
                throw new IllegalArgumentException("Ledger sequence gap at position " + i +
                        ": found " + assertions.get(i).sequence());
            }
        }
        return new AliasLedger(assertions);
    }

    public List<AliasAssertion> assertions() {
        return assertions;
    }

    public int size() {
        return assertions.size();
    }

    public boolean isEmpty() {
        return assertions.isEmpty();
    }

    /**
     * Batch ids in the order they were first applied.
     */
    public Set<String> batchIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (AliasAssertion assertion : assertions) {
            ids.add(assertion.batchId());
        }
        return ids;
    }

    public boolean containsBatch(String batchId) {
        for (AliasAssertion assertion : assertions) {
            if (assertion.batchId().equals(batchId)) {
                return true;
            }
        }
        return false;
    }

    public List<AliasAssertion> assertionsFor(String batchId) {
        return assertions.stream().filter(a -> a.batchId().equals(batchId)).toList();
    }

    /**
     * True if the ledger holds exactly these assertions for the batch, in this order.
     */
    public boolean hasSameContent(String batchId, List<AliasAssertion> candidate) {
        List<AliasAssertion> existing = assertionsFor(batchId);
        if (existing.size() != candidate.size()) {
            return false;
        }
        for (int i = 0; i < existing.size(); i++) {
            if (!existing.get(i).sameContent(candidate.get(i))) {
                return false;
            }
        }
        return true;
    }

    public AliasLedger append(List<AliasAssertion> batch) {
        List<AliasAssertion> next = new ArrayList<>(assertions.size() + batch.size());
        next.addAll(assertions);
        next.addAll(batch);
        return new AliasLedger(renumber(next));
    }

    /**
     * Replaces the assertions of an already applied batch, keeping the batch's
     * position in the ledger.
     */
    public AliasLedger replace(String batchId, List<AliasAssertion> batch) {
        Map<String, List<AliasAssertion>> grouped = new LinkedHashMap<>();
        for (AliasAssertion assertion : assertions) {
            grouped.computeIfAbsent(assertion.batchId(), k -> new ArrayList<>()).add(assertion);
        }
        if (!grouped.containsKey(batchId)) {
            throw new IllegalArgumentException("Batch not in ledger: " + batchId);
        }
        grouped.put(batchId, batch);

        List<AliasAssertion> next = new ArrayList<>();
        grouped.values().forEach(next::addAll);
        return new AliasLedger(renumber(next));
    }

    private static List<AliasAssertion> renumber(List<AliasAssertion> list) {
        List<AliasAssertion> numbered = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            numbered.add(list.get(i).withSequence(i));
        }
        return numbered;
    }
}
