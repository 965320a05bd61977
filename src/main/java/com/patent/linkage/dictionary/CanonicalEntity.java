package com.patent.linkage.dictionary;

import java.util.List;

/**
 * A canonical entity and the aliases currently resolving to it.
 *
 * @param entityId    stable surrogate id
 * @param displayName entity name as first asserted
 * @param aliasKeys   canonical alias keys, sorted
 * @param rawAliases  raw alias spellings behind those keys, sorted
 * @param batches     batches that asserted an alias for this entity, in ledger order
 */
public record CanonicalEntity(
        String entityId,
        String displayName,
        List<String> aliasKeys,
        List<String> rawAliases,
        List<String> batches
) {
    public CanonicalEntity {
        aliasKeys = List.copyOf(aliasKeys);
        rawAliases = List.copyOf(rawAliases);
        batches = List.copyOf(batches);
    }

    public int aliasCount() {
        return rawAliases.size();
    }
}
