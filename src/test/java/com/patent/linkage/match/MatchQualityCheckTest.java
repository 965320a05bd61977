package com.patent.linkage.match;

import com.patent.linkage.core.model.MatchCandidate;
import com.patent.linkage.core.model.MatchDecision;
import com.patent.linkage.core.model.MatchTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MatchQualityCheckTest {

    private final MatchQualityCheck check = new MatchQualityCheck();

    @Test
    @DisplayName("Clean output produces a clean report")
    void clean() {
        MatchQualityCheck.QualityReport report = check.check(List.of(
                MatchCandidate.exact("Acme Corp", "Acme Inc", "acme"),
                MatchCandidate.strict("IBM", "ibm", "International Business Machines",
                        "international business machines", StrictRuleMatcher.RULE_ACRONYM)));

        assertTrue(report.isClean());
        assertEquals(1, report.count(MatchTier.EXACT));
        assertEquals(1, report.count(MatchTier.STRICT_RULE));
        assertEquals(0, report.count(MatchTier.FUZZY));
    }

    @Test
    @DisplayName("Flags one-to-many links, low scores and short keys")
    void findings() {
        MatchCandidate first = MatchCandidate.exact("Acme", "Acme Inc", "acme");
        MatchCandidate second = new MatchCandidate("Acme", "acme", "Acme Holdings", "acme holdings",
                MatchTier.FUZZY, 91, MatchDecision.AUTO_ACCEPTED, "TokenSet");
        MatchCandidate shortKey = MatchCandidate.exact("GE", "G.E.", "ge");

        MatchQualityCheck.QualityReport report = check.check(List.of(first, second, shortKey));

        assertFalse(report.isClean());
        assertEquals(Set.of("Acme Inc", "Acme Holdings"), report.oneToMany().get("Acme"));
        assertEquals(List.of(second), report.lowScore());
        assertEquals(List.of(shortKey), report.shortKeys());
    }

    @Test
    @DisplayName("Report maps iterate in source name and tier order")
    void deterministicOrder() {
        List<MatchCandidate> candidates = List.of(
                new MatchCandidate("Zeta", "zeta", "Zeta Two", "zeta two",
                        MatchTier.FUZZY, 92, MatchDecision.NEEDS_REVIEW, "TokenSet"),
                MatchCandidate.exact("Zeta", "Zeta One", "zeta"),
                MatchCandidate.exact("Beta", "Beta Inc", "beta"),
                new MatchCandidate("Beta", "beta", "Beta Labs", "beta labs",
                        MatchTier.FUZZY, 90, MatchDecision.NEEDS_REVIEW, "TokenSet"),
                MatchCandidate.strict("Mu", "mu", "Mu Systems", "mu systems", StrictRuleMatcher.RULE_CONTAINMENT));

        MatchQualityCheck.QualityReport report = check.check(candidates);

        assertEquals(List.of("Beta", "Zeta"), List.copyOf(report.oneToMany().keySet()));
        assertEquals(List.of("Zeta One", "Zeta Two"), List.copyOf(report.oneToMany().get("Zeta")));
        assertEquals(List.of(MatchTier.EXACT, MatchTier.STRICT_RULE, MatchTier.FUZZY),
                List.copyOf(report.countsByTier().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> report.oneToMany().clear());
    }
}
