package com.patent.linkage.dictionary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Allocates entity ids by first observation of an entity's canonical key.
 * Ids are {@code E} followed by six digits and are never reused.
 */
final class EntityIdRegistry {

    private static final Pattern ID_PATTERN = Pattern.compile("E\\d{6,}");

    private final Map<String, String> idsByKey;

    private EntityIdRegistry(Map<String, String> idsByKey) {
        this.idsByKey = idsByKey;
    }

    static EntityIdRegistry empty() {
        return new EntityIdRegistry(new LinkedHashMap<>());
    }

    /**
     * Restores a registry; ids must be E000001..E{n} in insertion order.
     */
    static EntityIdRegistry restore(Map<String, String> idsByKey) {
        EntityIdRegistry registry = empty();
        int expected = 1;
        for (Map.Entry<String, String> entry : idsByKey.entrySet()) {
            String id = entry.getValue();
            if (id == null || !ID_PATTERN.matcher(id).matches() || !id.equals(format(expected))) {
                throw new IllegalArgumentException("Unexpected entity id " + id + " for '" + entry.getKey() +
                        "', expected " + format(expected));
            }
            registry.idsByKey.put(entry.getKey(), id);
            expected++;
        }
        return registry;
    }

    String idFor(String entityKey) {
        return idsByKey.computeIfAbsent(entityKey, key -> format(idsByKey.size() + 1));
    }

    EntityIdRegistry copy() {
        return new EntityIdRegistry(new LinkedHashMap<>(idsByKey));
    }

    Map<String, String> asMap() {
        return Collections.unmodifiableMap(idsByKey);
    }

    int size() {
        return idsByKey.size();
    }

    static String format(int number) {
        return String.format("E%06d", number);
    }
}
