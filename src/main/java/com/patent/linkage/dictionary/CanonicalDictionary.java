package com.patent.linkage.dictionary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Alias to entity mapping plus entity metadata, derived by replaying an
 * {@link AliasLedger}.
 *
 * <p>Every alias key resolves to exactly one entity id. Instances are
 * immutable; the {@link DictionaryBuilder} produces a new dictionary for every
 * build.</p>
 */
public final class CanonicalDictionary {

    private final AliasLedger ledger;
    private final EntityIdRegistry registry;
    private final SortedMap<String, String> entityByAlias;
    private final Map<String, AliasAssertion> lastAssertionByAlias;
    private final Map<String, SortedSet<String>> rawAliasesByKey;
    private final SortedMap<String, CanonicalEntity> entitiesById;
    private final List<ConflictRecord> conflicts;
    private final List<BatchContribution> contributions;

    private CanonicalDictionary(AliasLedger ledger,
                                EntityIdRegistry registry,
                                SortedMap<String, String> entityByAlias,
                                Map<String, AliasAssertion> lastAssertionByAlias,
                                Map<String, SortedSet<String>> rawAliasesByKey,
                                SortedMap<String, CanonicalEntity> entitiesById,
                                List<ConflictRecord> conflicts,
                                List<BatchContribution> contributions) {
        this.ledger = ledger;
        this.registry = registry;
        this.entityByAlias = Collections.unmodifiableSortedMap(entityByAlias);
        this.lastAssertionByAlias = Collections.unmodifiableMap(lastAssertionByAlias);
        this.rawAliasesByKey = Collections.unmodifiableMap(rawAliasesByKey);
        this.entitiesById = Collections.unmodifiableSortedMap(entitiesById);
        this.conflicts = List.copyOf(conflicts);
        this.contributions = List.copyOf(contributions);
    }

    public static CanonicalDictionary empty() {
        return replay(AliasLedger.empty(), EntityIdRegistry.empty());
    }

    /**
     * Derives the dictionary from a ledger. Entity ids already in the registry
     * are kept; new entity keys get the next free id. An entity is displayed
     * under the first spelling the ledger asserts for it. The registry passed in
     * is not modified.
     */
    static CanonicalDictionary replay(AliasLedger ledger, EntityIdRegistry seed) {
        EntityIdRegistry registry = seed.copy();
        SortedMap<String, String> entityByAlias = new TreeMap<>();
        Map<String, AliasAssertion> lastAssertion = new HashMap<>();
        Map<String, SortedSet<String>> rawAliasesByKey = new HashMap<>();
        Map<String, String> nameById = new HashMap<>();
        Map<String, Set<String>> batchesById = new HashMap<>();
        List<ConflictRecord> conflicts = new ArrayList<>();
        Map<String, long[]> counters = new LinkedHashMap<>();

        for (AliasAssertion assertion : ledger.assertions()) {
            String entityId = registry.idFor(assertion.entityKey());
            nameById.putIfAbsent(entityId, assertion.entityName());
            batchesById.computeIfAbsent(entityId, k -> new LinkedHashSet<>()).add(assertion.batchId());
            // assertions, new, duplicates, conflicts
            long[] counter = counters.computeIfAbsent(assertion.batchId(), k -> new long[4]);
            counter[0]++;

            String key = assertion.aliasKey();
            String current = entityByAlias.get(key);
            if (current == null) {
                counter[1]++;
            } else if (current.equals(entityId)) {
                counter[2]++;
            } else {
                counter[3]++;
                AliasAssertion previous = lastAssertion.get(key);
                conflicts.add(new ConflictRecord(key, assertion.rawAlias(),
                        current, nameById.get(current), previous.batchId(),
                        entityId, assertion.entityName(), assertion.batchId(),
                        ConflictRecord.Resolution.MOST_RECENT_WINS));
                rawAliasesByKey.remove(key);
            }
            entityByAlias.put(key, entityId);
            lastAssertion.put(key, assertion);
            rawAliasesByKey.computeIfAbsent(key, k -> new TreeSet<>()).add(assertion.rawAlias());
        }

        Map<String, SortedSet<String>> keysById = new HashMap<>();
        entityByAlias.forEach((key, id) -> keysById.computeIfAbsent(id, k -> new TreeSet<>()).add(key));

        SortedMap<String, CanonicalEntity> entities = new TreeMap<>();
        keysById.forEach((id, keys) -> {
            SortedSet<String> raw = new TreeSet<>();
            keys.forEach(key -> raw.addAll(rawAliasesByKey.get(key)));
            entities.put(id, new CanonicalEntity(id, nameById.get(id), new ArrayList<>(keys),
                    new ArrayList<>(raw), new ArrayList<>(batchesById.get(id))));
        });

        List<BatchContribution> contributions = new ArrayList<>();
        counters.forEach((batchId, c) ->
                contributions.add(new BatchContribution(batchId, c[0], c[1], c[2], c[3])));

        return new CanonicalDictionary(ledger, registry, entityByAlias, lastAssertion, rawAliasesByKey,
                entities, conflicts, contributions);
    }

    /**
     * Entity id for a canonical alias key.
     */
    public Optional<String> resolve(String aliasKey) {
        if (aliasKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entityByAlias.get(aliasKey));
    }

    public Optional<CanonicalEntity> entity(String entityId) {
        return Optional.ofNullable(entitiesById.get(entityId));
    }

    /**
     * Entity id assigned to a canonical entity key, if it was ever observed.
     */
    public Optional<String> entityIdFor(String entityKey) {
        if (entityKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registry.asMap().get(entityKey));
    }

    /**
     * The assertion that currently determines an alias's mapping.
     */
    public Optional<AliasAssertion> provenance(String aliasKey) {
        return Optional.ofNullable(lastAssertionByAlias.get(aliasKey));
    }

    /**
     * Raw spellings currently mapped through an alias key, sorted.
     */
    public SortedSet<String> rawAliases(String aliasKey) {
        SortedSet<String> raw = rawAliasesByKey.get(aliasKey);
        return raw != null ? Collections.unmodifiableSortedSet(raw) : Collections.emptySortedSet();
    }

    /**
     * Alias key to entity id, sorted by alias key.
     */
    public SortedMap<String, String> aliasMapping() {
        return entityByAlias;
    }

    /**
     * Entities with at least one alias, sorted by entity id.
     */
    public List<CanonicalEntity> entities() {
        return List.copyOf(entitiesById.values());
    }

    /**
     * Entities with the most raw aliases, ties broken by entity id.
     */
    public List<CanonicalEntity> topEntitiesByAliasCount(int limit) {
        return entitiesById.values().stream()
                .sorted(Comparator.comparingInt(CanonicalEntity::aliasCount).reversed()
                        .thenComparing(CanonicalEntity::entityId))
                .limit(limit)
                .toList();
    }

    /**
     * Every conflict met while replaying the ledger, in ledger order.
     */
    public List<ConflictRecord> conflicts() {
        return conflicts;
    }

    public List<BatchContribution> contributions() {
        return contributions;
    }

    public AliasLedger ledger() {
        return ledger;
    }

    /**
     * Canonical entity key to entity id, in allocation order.
     */
    public Map<String, String> entityRegistry() {
        return registry.asMap();
    }

    EntityIdRegistry registry() {
        return registry;
    }

    public int aliasCount() {
        return entityByAlias.size();
    }

    public int entityCount() {
        return entitiesById.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalDictionary that = (CanonicalDictionary) o;
        return entityByAlias.equals(that.entityByAlias)
                && ledger.assertions().equals(that.ledger.assertions())
                && registry.asMap().equals(that.registry.asMap());
    }

    @Override
    public int hashCode() {
        return entityByAlias.hashCode();
    }

    @Override
    public String toString() {
        return "CanonicalDictionary{aliases=" + aliasCount() +
                ", entities=" + entityCount() +
                ", conflicts=" + conflicts.size() +
                ", ledger=" + ledger.size() + '}';
    }
}
