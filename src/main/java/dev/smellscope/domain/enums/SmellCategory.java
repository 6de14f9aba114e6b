package dev.smellscope.domain.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Canonical smell categories. Backend-specific labels are mapped onto these
 * through the category table; anything unmapped lands in {@link #UNKNOWN}.
 * The display name is the wire form and the ordering key.
 */
public enum SmellCategory {
    LONG_METHOD("LongMethod"),
    LARGE_CLASS("LargeClass"),
    LONG_PARAMETER_LIST("LongParameterList"),
    DUPLICATE_CODE("DuplicateCode"),
    DEAD_CODE("DeadCode"),
    GOD_CLASS("GodClass"),
    FEATURE_ENVY("FeatureEnvy"),
    DATA_CLASS("DataClass"),
    DATA_CLUMPS("DataClumps"),
    COMPLEX_CONDITIONAL("ComplexConditional"),
    MAGIC_NUMBER("MagicNumber"),
    PRIMITIVE_OBSESSION("PrimitiveObsession"),
    SHOTGUN_SURGERY("ShotgunSurgery"),
    MESSAGE_CHAIN("MessageChain"),
    SPECULATIVE_GENERALITY("SpeculativeGenerality"),
    UNKNOWN("Unknown");

    private final String displayName;
    SmellCategory(String displayName) { this.displayName = displayName; }

    public String displayName() {
        return displayName;
    }

    /**
     * Matches a display name or enum constant, ignoring case and separators.
     */
    public static Optional<SmellCategory> fromName(String name) {
        String key = normalize(name);
        if (key.isEmpty()) return Optional.empty();
        return Arrays.stream(values())
                .filter(c -> normalize(c.displayName).equals(key) || normalize(c.name()).equals(key))
                .findFirst();
    }

    /** Lower-cases and strips everything but letters and digits. */
    public static String normalize(String label) {
        if (label == null) return "";
        return label.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
