package com.patent.linkage.rules;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Default normalization rules for company names found in patent assignee,
 * M&A acquiror and reference database name columns.
 *
 * <p>Order: lowercase, strip diacritics, collapse dotted acronyms, rewrite
 * ampersands and apostrophes, remove punctuation (internal hyphens survive),
 * collapse whitespace, expand abbreviations, strip trailing corporate suffixes.</p>
 */
public final class DefaultNormalizationRules {

    /**
     * Corporate suffix tokens removed when they trail the name.
     */
    public static final List<String> CORPORATE_SUFFIXES = List.of(
            "inc", "incorporated", "corp", "corporation", "co", "company",
            "ltd", "limited", "llc", "llp", "lp", "plc", "sa", "ag",
            "nv", "bv", "gmbh", "kk");

    private static final Map<String, String> ABBREVIATIONS = new LinkedHashMap<>();

    static {
        ABBREVIATIONS.put("intl", "international");
        ABBREVIATIONS.put("natl", "national");
        ABBREVIATIONS.put("mfg", "manufacturing");
        ABBREVIATIONS.put("tech", "technology");
        ABBREVIATIONS.put("sys", "systems");
    }

    private static final Pattern DOTTED_ACRONYM =
            Pattern.compile("(?<![\\p{L}\\p{N}])(?:[\\p{L}\\p{N}]\\.){2,}");
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getCharacterRules());
        engine.addRules(getAbbreviationRules());
        engine.addRules(getSuffixRules());
        return engine;
    }

    /**
     * Case folding, diacritics, symbols and whitespace.
     */
    public static List<NormalizationRule> getCharacterRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("lowercase")
                        .transform(s -> s.toLowerCase(Locale.ROOT))
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("strip-diacritics")
                        .transform(DefaultNormalizationRules::stripDiacritics)
                        .priority(20)
                        .build(),

                // "s.a." -> "sa", "i.b.m." -> "ibm"
                NormalizationRule.builder()
                        .name("dotted-acronym")
                        .transform(s -> DOTTED_ACRONYM.matcher(s).replaceAll(m -> m.group().replace(".", "")))
                        .priority(30)
                        .build(),

                NormalizationRule.builder()
                        .name("ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" and ")
                        .priority(40)
                        .build(),

                NormalizationRule.builder()
                        .name("apostrophe")
                        .pattern("['’`]")
                        .replacement("")
                        .priority(40)
                        .build(),

                NormalizationRule.builder()
                        .name("punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s-]")
                        .replacement(" ")
                        .priority(50)
                        .build(),

                // Only hyphens between two alphanumerics are kept
                NormalizationRule.builder()
                        .name("stray-hyphen")
                        .pattern("(?<![\\p{L}\\p{N}])-+|-+(?![\\p{L}\\p{N}])")
                        .replacement(" ")
                        .priority(55)
                        .build(),

                NormalizationRule.builder()
                        .name("collapse-whitespace")
                        .transform(s -> s.trim().replaceAll("\\s+", " "))
                        .priority(60)
                        .build()
        );
    }

    /**
     * Expands common abbreviations so both spellings share a key.
     */
    public static List<NormalizationRule> getAbbreviationRules() {
        List<NormalizationRule> rules = new ArrayList<>();
        ABBREVIATIONS.forEach((abbreviation, expansion) -> rules.add(
                NormalizationRule.builder()
                        .name("abbreviation-" + abbreviation)
                        .pattern("\\b" + abbreviation + "\\b")
                        .replacement(expansion)
                        .priority(70)
                        .build()));
        return List.copyOf(rules);
    }

    /**
     * Strips trailing corporate suffix tokens. A suffix must follow another
     * token, so a name consisting of a single suffix word is left alone.
     */
    public static List<NormalizationRule> getSuffixRules() {
        String alternatives = String.join("|", CORPORATE_SUFFIXES);
        return List.of(
                NormalizationRule.builder()
                        .name("trailing-corporate-suffix")
                        .pattern("(?:\\s+(?:" + alternatives + "))+$")
                        .replacement("")
                        .priority(80)
                        .build()
        );
    }

    static String stripDiacritics(String input) {
        String decomposed = Normalizer.normalize(input, Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        // Letters NFD does not decompose
        return stripped
                .replace("ß", "ss")
                .replace("ø", "o")
                .replace("æ", "ae")
                .replace("œ", "oe")
                .replace("ł", "l")
                .replace("đ", "d");
    }
}
