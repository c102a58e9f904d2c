package org.pep2rpm.translator.capability;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An RPM capability name with an optional placeholder, e.g. {@code python3-{name}} or
 * {@code python({arch})}. Every occurrence of the placeholder is replaced by the same value.
 */
public final class CapabilityTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private final String template;
    private final Set<String> placeholders;

    private CapabilityTemplate(String template, Set<String> placeholders) {
        this.template = template;
        this.placeholders = placeholders;
    }

    /**
     * Parses a template.
     * @param template The template text.
     * @return The template.
     * @throws IllegalArgumentException if the template is blank or names more than one placeholder.
     */
    public static CapabilityTemplate of(String template) {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("Capability template must not be blank");
        }
        Set<String> placeholders = new LinkedHashSet<>();
        Matcher m = PLACEHOLDER.matcher(template);
        while (m.find()) {
            placeholders.add(m.group(1));
        }
        if (placeholders.size() > 1) {
            throw new IllegalArgumentException(
                    "Capability template '" + template + "' has more than one placeholder: " + placeholders);
        }
        return new CapabilityTemplate(template.trim(), Set.copyOf(placeholders));
    }

    /**
     * @return true if the template contains a placeholder.
     */
    public boolean isParameterized() {
        return !placeholders.isEmpty();
    }

    /**
     * Substitutes the placeholder.
     * @param value The value to substitute.
     * @return The capability name; the template itself when it has no placeholder.
     */
    public String format(String value) {
        if (placeholders.isEmpty()) {
            return template;
        }
        return PLACEHOLDER.matcher(template).replaceAll(Matcher.quoteReplacement(value));
    }

    /**
     * @return The template text.
     */
    public String text() {
        return template;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CapabilityTemplate other && template.equals(other.template);
    }

    @Override
    public int hashCode() {
        return template.hashCode();
    }

    @Override
    public String toString() {
        return template;
    }
}
