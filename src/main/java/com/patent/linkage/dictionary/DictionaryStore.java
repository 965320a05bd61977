package com.patent.linkage.dictionary;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Saves and loads a {@link CanonicalDictionary} as a JSON document.
 *
 * <p>The document holds the alias ledger, the entity id registry and the derived
 * alias mapping. Loading replays the ledger and rejects the file if the result
 * does not reproduce the stored mapping exactly. Saving writes a temporary file
 * next to the target and moves it into place, so readers never see a partial
 * file.</p>
 */
public class DictionaryStore {
    private static final Logger log = LoggerFactory.getLogger(DictionaryStore.class);

    static final int FORMAT_VERSION = 2;

    private final ObjectMapper objectMapper;

    public DictionaryStore() {
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    /**
     * Persisted form of a dictionary.
     */
    public record DictionaryDocument(
            int formatVersion,
            List<RegistryEntry> registry,
            List<AliasAssertion> ledger,
            Map<String, String> aliasMapping
    ) {
    }

    public record RegistryEntry(String entityKey, String entityId) {
    }

    public void save(CanonicalDictionary dictionary, Path file) {
        List<RegistryEntry> registry = new ArrayList<>();
        dictionary.entityRegistry().forEach((key, id) -> registry.add(new RegistryEntry(key, id)));
        DictionaryDocument document = new DictionaryDocument(FORMAT_VERSION, registry,
                dictionary.ledger().assertions(), new TreeMap<>(dictionary.aliasMapping()));

        Path target = file.toAbsolutePath();
        Path tmp = null;
        try {
            Path dir = target.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), document);
            moveIntoPlace(tmp, target);
            log.info("dictionary.saved path={} aliases={} entities={} ledger={}",
                    target, dictionary.aliasCount(), dictionary.entityCount(), dictionary.ledger().size());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new DictionaryPersistenceException("Failed to write dictionary to " + target, e);
        }
    }

    public CanonicalDictionary load(Path file) {
        DictionaryDocument document;
        try {
            document = objectMapper.readValue(file.toFile(), DictionaryDocument.class);
        } catch (IOException e) {
            throw new DictionaryPersistenceException("Failed to read dictionary from " + file, e);
        }
        if (document.formatVersion() != FORMAT_VERSION) {
            throw new DictionaryPersistenceException("Unsupported dictionary format version " +
                    document.formatVersion() + " in " + file);
        }

        CanonicalDictionary dictionary;
        try {
            Map<String, String> ids = new LinkedHashMap<>();
            for (RegistryEntry entry : nullSafe(document.registry())) {
                if (ids.put(entry.entityKey(), entry.entityId()) != null) {
                    throw new IllegalArgumentException("Duplicate entity key in registry: " + entry.entityKey());
                }
            }
            EntityIdRegistry registry = EntityIdRegistry.restore(ids);
            dictionary = CanonicalDictionary.replay(AliasLedger.of(nullSafe(document.ledger())), registry);
            if (dictionary.entityRegistry().size() != registry.size()) {
                throw new IllegalArgumentException("Ledger names entities missing from the registry");
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new DictionaryPersistenceException("Corrupt dictionary " + file + ": " + e.getMessage(), e);
        }

        Map<String, String> stored = document.aliasMapping() != null ? document.aliasMapping() : Map.of();
        if (!dictionary.aliasMapping().equals(stored)) {
            throw new DictionaryPersistenceException("Dictionary " + file +
                    " is inconsistent: stored alias mapping does not match its ledger");
        }
        log.info("dictionary.loaded path={} aliases={} entities={} ledger={}",
                file, dictionary.aliasCount(), dictionary.entityCount(), dictionary.ledger().size());
        return dictionary;
    }

    /**
     * Loads the dictionary, or returns an empty one when the file does not exist yet.
     */
    public CanonicalDictionary loadOrEmpty(Path file) {
        if (!Files.exists(file)) {
            log.info("dictionary.missing path={}, starting empty", file);
            return CanonicalDictionary.empty();
        }
        return load(file);
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("dictionary.save atomic move unsupported, falling back to replace");
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("dictionary.tmp.cleanup.failed path={} error={}", tmp, e.getMessage());
        }
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }
}
