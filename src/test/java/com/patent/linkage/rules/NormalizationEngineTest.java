package com.patent.linkage.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should map null, empty and whitespace-only input to the empty key")
    void testNullAndBlankInputs() {
        assertEquals(NameNormalizer.EMPTY_KEY, engine.normalize(null));
        assertEquals(NameNormalizer.EMPTY_KEY, engine.normalize(""));
        assertEquals(NameNormalizer.EMPTY_KEY, engine.normalize("   \t "));
        assertEquals(NameNormalizer.EMPTY_KEY, engine.normalize("---"));
        assertEquals(NameNormalizer.EMPTY_KEY, engine.normalize("!!!"));
    }

    @ParameterizedTest
    @DisplayName("Should strip trailing corporate suffixes")
    @CsvSource({
            "Acme Corp,acme",
            "ACME INC,acme",
            "Acme Co.,acme",
            "Acme Co Ltd,acme",
            "Acme Corporation,acme",
            "Acme Limited,acme",
            "Acme PLC,acme",
            "Acme S.A.,acme",
            "Acme AG,acme",
            "Acme GmbH,acme"
    })
    void testCorporateSuffixes(String input, String expected) {
        assertEquals(expected, engine.normalize(input));
    }

    @Test
    @DisplayName("Should keep suffix words that are not trailing")
    void testEmbeddedSuffixKept() {
        assertEquals("acme co holdings", engine.normalize("Acme Co Holdings"));
        assertEquals("inc research", engine.normalize("Inc Research"));
    }

    @Test
    @DisplayName("Should not strip a name consisting of a single suffix word")
    void testOnlySuffixKept() {
        assertEquals("corp", engine.normalize("Corp"));
        assertEquals("company", engine.normalize("COMPANY"));
    }

    @Test
    @DisplayName("Should strip diacritics")
    void testDiacritics() {
        assertEquals("societe generale", engine.normalize("Société Générale S.A."));
        assertEquals("nestle", engine.normalize("Nestlé SA"));
        assertEquals("strasse", engine.normalize("Straße"));
    }

    @Test
    @DisplayName("Should keep internal hyphens and drop stray ones")
    void testHyphens() {
        assertEquals("coca-cola", engine.normalize("Coca-Cola Co"));
        assertEquals("acme labs", engine.normalize("Acme - Labs"));
        assertEquals("acme", engine.normalize("-Acme-"));
    }

    @Test
    @DisplayName("Should rewrite ampersands and delete apostrophes")
    void testAmpersandAndApostrophe() {
        assertEquals("procter and gamble", engine.normalize("Procter & Gamble"));
        assertEquals("procter and gamble", engine.normalize("Procter&Gamble Co."));
        assertEquals("mcdonalds", engine.normalize("McDonald's Corp"));
    }

    @Test
    @DisplayName("Should collapse dotted acronyms")
    void testDottedAcronyms() {
        assertEquals("ibm", engine.normalize("I.B.M. Corp"));
        assertEquals("at and t", engine.normalize("A.T. & T."));
    }

    @ParameterizedTest
    @DisplayName("Should expand common abbreviations")
    @CsvSource({
            "Acme Intl,acme international",
            "First Natl Bank,first national bank",
            "Acme Mfg Co,acme manufacturing",
            "Acme Tech Inc,acme technology",
            "Acme Sys,acme systems"
    })
    void testAbbreviations(String input, String expected) {
        assertEquals(expected, engine.normalize(input));
    }

    @Test
    @DisplayName("Should collapse whitespace and punctuation")
    void testWhitespace() {
        assertEquals("big blue", engine.normalize("  Big    Blue  "));
        assertEquals("amazon com", engine.normalize("Amazon.com, Inc."));
    }

    @Test
    @DisplayName("Should be deterministic")
    void testDeterministic() {
        String first = engine.normalize("Ünïcode Héavy Co., Ltd.");
        for (int i = 0; i < 10; i++) {
            assertEquals(first, engine.normalize("Ünïcode Héavy Co., Ltd."));
        }
        assertEquals("unicode heavy", first);
    }

    @Test
    @DisplayName("Should report equivalence of names sharing a key")
    void testAreEquivalent() {
        assertTrue(engine.areEquivalent("Acme Corp", "ACME INC"));
        assertFalse(engine.areEquivalent("Acme Corp", "Apex Corp"));
    }

    @Test
    @DisplayName("Should apply custom rules in priority order")
    void testCustomRules() {
        NormalizationEngine custom = new NormalizationEngine();
        custom.addRule(NormalizationRule.builder()
                .name("second")
                .pattern("b")
                .replacement("c")
                .priority(20)
                .build());
        custom.addRule(NormalizationRule.builder()
                .name("first")
                .pattern("a")
                .replacement("b")
                .priority(10)
                .build());

        assertEquals("cc", custom.normalize("ab"));
        assertTrue(custom.removeRule("second"));
        assertEquals("bb", custom.normalize("ab"));
    }
}
