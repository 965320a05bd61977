package com.patent.linkage.match;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits sources into strata by patent volume so that high-volume names get a
 * looser fuzzy threshold and the long tail is matched exactly only.
 *
 * <ul>
 *   <li>{@code TOP}: the top fraction by volume (default 5%), base options.</li>
 *   <li>{@code ACTIVE}: remaining sources above the volume floor (default more
 *       than 5 patents); only perfect fuzzy scores are auto-accepted.</li>
 *   <li>{@code TAIL}: everything else; exact and strict-rule tiers only.</li>
 * </ul>
 */
public class SourceStratifier {

    public static final double DEFAULT_TOP_FRACTION = 0.05;
    public static final long DEFAULT_ACTIVE_MIN_VOLUME = 6;
    public static final double ACTIVE_FUZZY_THRESHOLD = 100;
    public static final double ACTIVE_REJECT_FLOOR = 95;

    private final double topFraction;
    private final long activeMinVolume;

    public SourceStratifier() {
        this(DEFAULT_TOP_FRACTION, DEFAULT_ACTIVE_MIN_VOLUME);
    }

    public SourceStratifier(double topFraction, long activeMinVolume) {
        if (topFraction <= 0.0 || topFraction > 1.0) {
            throw new IllegalArgumentException("topFraction must be in (0, 1]");
        }
        if (activeMinVolume < 0) {
            throw new IllegalArgumentException("activeMinVolume must be >= 0");
        }
        this.topFraction = topFraction;
        this.activeMinVolume = activeMinVolume;
    }

    /**
     * A source name with its patent volume.
     */
    public record SourceVolume(String name, long patentCount) {
        public SourceVolume {
            if (patentCount < 0) {
                throw new IllegalArgumentException("patentCount must be >= 0");
            }
        }
    }

    /**
     * One group of sources and the options to match it with.
     */
    public record Stratum(String name, List<String> sources, MatchOptions options) {
        public Stratum {
            sources = List.copyOf(sources);
        }
    }

    /**
     * Stratifies by volume. Volumes of repeated names are summed; ties are
     * ordered by name so the split is reproducible. Empty strata are omitted.
     */
    public List<Stratum> stratify(List<SourceVolume> volumes, MatchOptions baseOptions) {
        Map<String, Long> totals = new LinkedHashMap<>();
        for (SourceVolume volume : volumes) {
            if (volume.name() == null) {
                continue;
            }
            totals.merge(volume.name(), volume.patentCount(), Long::sum);
        }

        List<Map.Entry<String, Long>> ranked = new ArrayList<>(totals.entrySet());
        ranked.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));

        int topCount = ranked.isEmpty() ? 0 : (int) Math.ceil(ranked.size() * topFraction);
        List<String> top = new ArrayList<>();
        List<String> active = new ArrayList<>();
        List<String> tail = new ArrayList<>();
        for (int i = 0; i < ranked.size(); i++) {
            Map.Entry<String, Long> entry = ranked.get(i);
            if (i < topCount) {
                top.add(entry.getKey());
            } else if (entry.getValue() >= activeMinVolume) {
                active.add(entry.getKey());
            } else {
                tail.add(entry.getKey());
            }
        }

        List<Stratum> strata = new ArrayList<>(3);
        if (!top.isEmpty()) {
            strata.add(new Stratum("TOP", top, baseOptions));
        }
        if (!active.isEmpty()) {
            strata.add(new Stratum("ACTIVE", active, baseOptions.toBuilder()
                    .rejectFloor(ACTIVE_REJECT_FLOOR)
                    .fuzzyThreshold(ACTIVE_FUZZY_THRESHOLD)
                    .build()));
        }
        if (!tail.isEmpty()) {
            strata.add(new Stratum("TAIL", tail, baseOptions.toBuilder().fuzzyEnabled(false).build()));
        }
        return strata;
    }
}
