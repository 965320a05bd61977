package com.patent.linkage.match;

import com.patent.linkage.match.SourceStratifier.SourceVolume;
import com.patent.linkage.match.SourceStratifier.Stratum;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceStratifierTest {

    private final SourceStratifier stratifier = new SourceStratifier();

    @Test
    @DisplayName("Should split sources into top, active and tail strata")
    void stratify() {
        List<SourceVolume> volumes = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            volumes.add(new SourceVolume(String.format("Company %02d", i), i));
        }

        List<Stratum> strata = stratifier.stratify(volumes, MatchOptions.defaults());

        assertEquals(3, strata.size());
        assertEquals("TOP", strata.get(0).name());
        assertEquals(List.of("Company 19"), strata.get(0).sources());
        assertEquals(90, strata.get(0).options().getFuzzyThreshold());

        assertEquals("ACTIVE", strata.get(1).name());
        assertEquals(13, strata.get(1).sources().size());
        assertEquals("Company 18", strata.get(1).sources().get(0));
        assertEquals(100, strata.get(1).options().getFuzzyThreshold());
        assertEquals(95, strata.get(1).options().getRejectFloor());

        assertEquals("TAIL", strata.get(2).name());
        assertEquals(6, strata.get(2).sources().size());
        assertFalse(strata.get(2).options().isFuzzyEnabled());
    }

    @Test
    @DisplayName("Volumes of repeated names are summed and ties ordered by name")
    void sumsAndTies() {
        List<Stratum> strata = new SourceStratifier(0.5, 6).stratify(List.of(
                new SourceVolume("Beta", 5),
                new SourceVolume("Alpha", 10),
                new SourceVolume("Beta", 5),
                new SourceVolume("Gamma", 1)), MatchOptions.defaults());

        assertEquals(List.of("Alpha", "Beta"), strata.get(0).sources());
        assertEquals("TAIL", strata.get(1).name());
        assertEquals(List.of("Gamma"), strata.get(1).sources());
    }

    @Test
    @DisplayName("Empty input yields no strata")
    void empty() {
        assertTrue(stratifier.stratify(List.of(), MatchOptions.defaults()).isEmpty());
    }

    @Test
    @DisplayName("Should validate parameters")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new SourceStratifier(0, 6));
        assertThrows(IllegalArgumentException.class, () -> new SourceStratifier(1.5, 6));
        assertThrows(IllegalArgumentException.class, () -> new SourceVolume("Acme", -1));
    }
}
