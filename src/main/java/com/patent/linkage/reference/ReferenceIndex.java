package com.patent.linkage.reference;

import com.patent.linkage.core.model.IdentifierSet;
import com.patent.linkage.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reference dataset reduced to what matching needs: one identifier set per
 * canonical company key.
 *
 * <p>Rows whose name normalizes to an already indexed key are dropped, keeping
 * the first row. Rows with a blank name are dropped as well.</p>
 */
public final class ReferenceIndex {
    private static final Logger log = LoggerFactory.getLogger(ReferenceIndex.class);

    private final Map<String, IdentifierSet> byKey;
    private final int droppedRows;

    private ReferenceIndex(Map<String, IdentifierSet> byKey, int droppedRows) {
        this.byKey = Collections.unmodifiableMap(byKey);
        this.droppedRows = droppedRows;
    }

    public static ReferenceIndex build(List<IdentifierSet> rows, NameNormalizer normalizer) {
        Map<String, IdentifierSet> byKey = new LinkedHashMap<>();
        int dropped = 0;
        for (IdentifierSet row : rows) {
            String key = normalizer.normalize(row.referenceName());
            if (key.isEmpty() || byKey.containsKey(key)) {
                dropped++;
                continue;
            }
            byKey.put(key, row);
        }
        log.info("reference.index.built rows={} distinct={} dropped={}", rows.size(), byKey.size(), dropped);
        return new ReferenceIndex(byKey, dropped);
    }

    /**
     * Reference names to match against, one per key, in input order.
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(byKey.size());
        byKey.values().forEach(row -> names.add(row.referenceName()));
        return names;
    }

    public Optional<IdentifierSet> lookup(String key) {
        return Optional.ofNullable(byKey.get(key));
    }

    public int size() {
        return byKey.size();
    }

    public int droppedRows() {
        return droppedRows;
    }
}
