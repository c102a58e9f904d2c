package org.pep2rpm.translator.version;

import java.util.Locale;

/**
 * Pre-release phases of PEP 440, in ascending order.
 */
public enum PrePhase {
    ALPHA("a"),
    BETA("b"),
    RELEASE_CANDIDATE("rc");

    private final String label;

    PrePhase(String label) {
        this.label = label;
    }

    /**
     * @return The normalized label of this phase ({@code a}, {@code b} or {@code rc}).
     */
    public String label() {
        return label;
    }

    /**
     * Maps any spelling PEP 440 accepts for a pre-release phase to its phase.
     * @param spelling The label as written, e.g. {@code alpha}, {@code c} or {@code preview}.
     * @return The phase.
     * @throws IllegalArgumentException if the spelling is not a pre-release label.
     */
    public static PrePhase fromSpelling(String spelling) {
        return switch (spelling.toLowerCase(Locale.ROOT)) {
            case "a", "alpha" -> ALPHA;
            case "b", "beta" -> BETA;
            case "rc", "c", "pre", "preview" -> RELEASE_CANDIDATE;
            default -> throw new IllegalArgumentException("Not a pre-release label: " + spelling);
        };
    }
}
