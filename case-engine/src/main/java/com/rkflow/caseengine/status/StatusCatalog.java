package com.rkflow.caseengine.status;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed, process-wide status table of the case pipeline.
 *
 * Every status name maps to a strictly increasing integer level:
 *
 *   Awaiting Confirmation (1) → Proposal Check (2)
 *     → round cycle, levels 3..26 (proposal / adjust / setup / waiting × round tags)
 *     → Negotiation (27) → Awarded (28) → Onboarding (29) → Status Check (30) → Offboarding (31)
 *
 * The 24 round-based names are derived once at class initialisation by crossing
 * the four {@link Stage}s with the six round tags (1/1, 1/2, 1/3, 2/2, 2/3, 3/3).
 * All maps are unmodifiable; nothing here is computed per request.
 *
 * Transition code must go through this class for every comparison instead of
 * matching status strings directly.
 */
public final class StatusCatalog {

    public static final String INIT             = "Awaiting Confirmation";
    public static final String CONFIRM_PROPOSAL = "Proposal Check";
    public static final String NEGOTIATION      = "Negotiation";
    public static final String AWARDED          = "Awarded";
    public static final String ONBOARDING       = "Onboarding";
    public static final String STATUS_CHECK     = "Status Check";
    public static final String OFFBOARDING      = "Offboarding";

    // Pipeline order. Position + 1 is the level.
    private static final List<String> ORDER = List.of(
            INIT,
            CONFIRM_PROPOSAL,
            "Proposal Sent",            "1/2 Proposal Sent",        "1/3 Proposal Sent",
            "Interview Scheduling",     "1/2 Interview Scheduling", "1/3 Interview Scheduling",
            "Interview Set",            "1/2 Interview Set",        "1/3 Interview Set",
            "Awaiting Result",          "1/2 Awaiting Result",      "1/3 Awaiting Result",
            "2/2 Proposal Sent",        "2/3 Proposal Sent",
            "2/2 Interview Scheduling", "2/3 Interview Scheduling",
            "2/2 Interview Set",        "2/3 Interview Set",
            "2/2 Awaiting Result",      "2/3 Awaiting Result",
            "3/3 Proposal Sent",
            "3/3 Interview Scheduling",
            "3/3 Interview Set",
            "3/3 Awaiting Result",
            NEGOTIATION,
            AWARDED,
            ONBOARDING,
            STATUS_CHECK,
            OFFBOARDING
    );

    // Round tag → {round, totalRounds}. The 1/1 tag has no display prefix.
    private static final Map<String, int[]> ROUND_TAGS;
    static {
        Map<String, int[]> tags = new LinkedHashMap<>();
        tags.put("",    new int[] {1, 1});
        tags.put("1/2", new int[] {1, 2});
        tags.put("1/3", new int[] {1, 3});
        tags.put("2/2", new int[] {2, 2});
        tags.put("2/3", new int[] {2, 3});
        tags.put("3/3", new int[] {3, 3});
        ROUND_TAGS = Collections.unmodifiableMap(tags);
    }

    private static final Map<String, Integer>    LEVELS;
    private static final Map<String, StatusMeta> META;

    public static final int INIT_LEVEL          = 1;
    public static final int MAX_INTERVIEW_LEVEL = 26;
    public static final int AWARDED_LEVEL;
    public static final int NO_ROLLBACK_LEVEL;

    static {
        Map<String, Integer> levels = new LinkedHashMap<>();
        for (int i = 0; i < ORDER.size(); i++) {
            levels.put(ORDER.get(i), i + 1);
        }
        LEVELS = Collections.unmodifiableMap(levels);

        Map<String, StatusMeta> meta = new LinkedHashMap<>();
        for (Map.Entry<String, int[]> tag : ROUND_TAGS.entrySet()) {
            for (Stage stage : Stage.values()) {
                if (!stage.isRoundBased()) continue;
                String name = tag.getKey().isEmpty()
                        ? stage.suffix()
                        : tag.getKey() + " " + stage.suffix();
                if (!LEVELS.containsKey(name)) {
                    throw new IllegalStateException("Round status missing from pipeline order: " + name);
                }
                meta.put(name, new StatusMeta(stage, tag.getValue()[0], tag.getValue()[1]));
            }
        }
        META = Collections.unmodifiableMap(meta);

        AWARDED_LEVEL     = LEVELS.get(AWARDED);
        NO_ROLLBACK_LEVEL = LEVELS.get(ONBOARDING);
        if (LEVELS.get(NEGOTIATION) != MAX_INTERVIEW_LEVEL + 1) {
            throw new IllegalStateException("Round cycle must end right before " + NEGOTIATION);
        }
    }

    private StatusCatalog() {}

    // ------------------------------------------------------------------
    // Core lookups
    // ------------------------------------------------------------------

    public static boolean isKnown(String name) {
        return name != null && LEVELS.containsKey(name);
    }

    /**
     * Level of a catalog name.
     *
     * @throws IllegalArgumentException if the name is not in the catalog
     */
    public static int levelOf(String name) {
        Integer level = name == null ? null : LEVELS.get(name);
        if (level == null) {
            throw new IllegalArgumentException("Unknown case status: '" + name + "'");
        }
        return level;
    }

    /**
     * Level of a value read back from storage. Null or unknown values rank 0,
     * below every real status.
     */
    public static int persistedLevel(String name) {
        Integer level = name == null ? null : LEVELS.get(name);
        return level == null ? 0 : level;
    }

    /** Round metadata; {@link StatusMeta#OTHER} for names outside the round cycle. */
    public static StatusMeta metaOf(String name) {
        StatusMeta meta = name == null ? null : META.get(name);
        return meta == null ? StatusMeta.OTHER : meta;
    }

    /** The round-based name for (round, totalRounds, stage), if the combination exists. */
    public static Optional<String> statusAt(int round, int totalRounds, Stage stage) {
        return META.entrySet().stream()
                .filter(e -> e.getValue().stage() == stage
                          && e.getValue().round() == round
                          && e.getValue().totalRounds() == totalRounds)
                .map(Map.Entry::getKey)
                .findFirst();
    }

    /** Every proposal name whose total is totalRounds, in level order. */
    public static List<String> proposalNamesFor(Integer totalRounds) {
        if (totalRounds == null) return List.of();
        return META.entrySet().stream()
                .filter(e -> e.getValue().stage() == Stage.PROPOSAL
                          && e.getValue().totalRounds().equals(totalRounds))
                .map(Map.Entry::getKey)
                .sorted(BY_LEVEL)
                .toList();
    }

    // ------------------------------------------------------------------
    // Derived views
    // ------------------------------------------------------------------

    /** All names of a stage at a given round, across every total. */
    public static List<String> namesAt(Stage stage, int round) {
        return META.entrySet().stream()
                .filter(e -> e.getValue().stage() == stage && e.getValue().round() == round)
                .map(Map.Entry::getKey)
                .sorted(BY_LEVEL)
                .toList();
    }

    public static List<String> allProposals() {
        return META.entrySet().stream()
                .filter(e -> e.getValue().stage() == Stage.PROPOSAL)
                .map(Map.Entry::getKey)
                .sorted(BY_LEVEL)
                .toList();
    }

    /**
     * Group-normalized level: for a round-based name, the lowest level among
     * all names sharing its stage and round (any total). A rollback cuts a whole
     * stage/round group at once rather than a single numeric level.
     */
    public static int groupLevel(String name) {
        StatusMeta meta = metaOf(name);
        if (!meta.isRoundBased()) {
            return persistedLevel(name);
        }
        return namesAt(meta.stage(), meta.round()).stream()
                .mapToInt(StatusCatalog::levelOf)
                .min()
                .orElse(persistedLevel(name));
    }

    /** Highest totalRounds found among the given names; 1 when none is round-based. */
    public static int maxTotalRounds(Collection<String> names) {
        int max = 1;
        for (String name : names) {
            StatusMeta meta = metaOf(name);
            if (meta.isRoundBased()) {
                max = Math.max(max, meta.totalRounds());
            }
        }
        return max;
    }

    /** Every catalog name in pipeline order. */
    public static List<String> names() {
        return ORDER;
    }

    public static final Comparator<String> BY_LEVEL = Comparator.comparingInt(StatusCatalog::persistedLevel);
}
