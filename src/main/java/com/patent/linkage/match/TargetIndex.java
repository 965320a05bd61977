package com.patent.linkage.match;

import com.patent.linkage.rules.NameNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only lookup structure over the target (reference) names of one run.
 *
 * <p>Each distinct canonical key maps to a representative raw name, the first
 * raw name observed with that key. Targets that normalize to the empty key are
 * dropped. The index is built once per run and shared by all fuzzy workers
 * without copying.</p>
 */
public final class TargetIndex {

    private final Map<String, String> representatives;
    private final List<String> keys;
    private final Map<String, Set<String>> byCompactForm;
    private final Map<String, Set<String>> byInitials;
    private final Map<String, Set<String>> byToken;
    private final int blankTargets;

    private TargetIndex(Map<String, String> representatives, int blankTargets) {
        this.representatives = Collections.unmodifiableMap(representatives);
        this.keys = List.copyOf(representatives.keySet());
        this.blankTargets = blankTargets;

        Map<String, Set<String>> compact = new HashMap<>();
        Map<String, Set<String>> initials = new HashMap<>();
        Map<String, Set<String>> tokens = new HashMap<>();
        for (String key : keys) {
            compact.computeIfAbsent(compactForm(key), k -> new TreeSet<>()).add(key);
            List<String> keyTokens = tokens(key);
            if (keyTokens.size() > 1) {
                initials.computeIfAbsent(initialsOf(keyTokens), k -> new TreeSet<>()).add(key);
            }
            for (String token : keyTokens) {
                tokens.computeIfAbsent(token, k -> new TreeSet<>()).add(key);
            }
        }
        this.byCompactForm = compact;
        this.byInitials = initials;
        this.byToken = tokens;
    }

    /**
     * Normalizes every target name and indexes it by canonical key.
     */
    public static TargetIndex build(List<String> targetNames, NameNormalizer normalizer) {
        Map<String, String> representatives = new LinkedHashMap<>();
        int blank = 0;
        for (String raw : targetNames) {
            String key = normalizer.normalize(raw);
            if (key.isEmpty()) {
                blank++;
                continue;
            }
            representatives.putIfAbsent(key, raw);
        }
        return new TargetIndex(representatives, blank);
    }

    public boolean contains(String key) {
        return representatives.containsKey(key);
    }

    /**
     * Raw name representing the given key, or null if the key is not indexed.
     */
    public String representative(String key) {
        return representatives.get(key);
    }

    /**
     * Distinct keys in first-observation order.
     */
    public List<String> keys() {
        return keys;
    }

    public int size() {
        return keys.size();
    }

    public int blankTargets() {
        return blankTargets;
    }

    Set<String> keysWithCompactForm(String compact) {
        return byCompactForm.getOrDefault(compact, Collections.emptySet());
    }

    Set<String> keysWithInitials(String initials) {
        return byInitials.getOrDefault(initials, Collections.emptySet());
    }

    Set<String> keysWithToken(String token) {
        return byToken.getOrDefault(token, Collections.emptySet());
    }

    static String compactForm(String key) {
        StringBuilder sb = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c != ' ' && c != '-') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static List<String> tokens(String key) {
        List<String> result = new ArrayList<>();
        for (String token : key.split(" ")) {
            if (!token.isEmpty()) {
                result.add(token);
            }
        }
        return result;
    }

    static String initialsOf(List<String> tokens) {
        StringBuilder sb = new StringBuilder(tokens.size());
        for (String token : tokens) {
            sb.append(token.charAt(0));
        }
        return sb.toString();
    }
}
