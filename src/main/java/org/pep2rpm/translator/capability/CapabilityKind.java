package org.pep2rpm.translator.capability;

import java.util.Locale;

/**
 * How a marker variable that is only known on the installing machine maps onto RPM capabilities.
 */
public enum CapabilityKind {
    /**
     * The literal is part of the capability name, e.g. {@code python(x86-64)}. Only {@code ==}
     * and {@code !=} can be expressed, as {@code with} and {@code without}.
     */
    EQUALITY_ONLY,
    /**
     * The capability name is fixed and versioned, e.g. {@code kernel}. Any ordered comparison can
     * be expressed against its version.
     */
    ORDERED;

    /**
     * Parses the configuration spelling of a kind: {@code equality-only} or {@code ordered}.
     * @throws IllegalArgumentException for any other spelling.
     */
    public static CapabilityKind fromConfig(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT).replace('_', '-')) {
            case "equality-only", "equality" -> EQUALITY_ONLY;
            case "ordered" -> ORDERED;
            default -> throw new IllegalArgumentException("Unknown capability kind: " + value);
        };
    }
}
