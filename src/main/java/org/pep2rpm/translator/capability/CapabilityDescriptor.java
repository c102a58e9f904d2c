package org.pep2rpm.translator.capability;

/**
 * The RPM capability a dynamic marker variable is translated to.
 *
 * @param kind     Whether the literal goes into the name or is compared as a version.
 * @param template The capability name; parameterized exactly when the kind is equality-only.
 */
public record CapabilityDescriptor(CapabilityKind kind, CapabilityTemplate template) {

    public CapabilityDescriptor {
        if (kind == CapabilityKind.EQUALITY_ONLY && !template.isParameterized()) {
            throw new IllegalArgumentException(
                    "Equality-only capability '" + template + "' needs a placeholder for the marker literal");
        }
        if (kind == CapabilityKind.ORDERED && template.isParameterized()) {
            throw new IllegalArgumentException(
                    "Ordered capability '" + template + "' must be a fixed name");
        }
    }

    public static CapabilityDescriptor equalityOnly(String template) {
        return new CapabilityDescriptor(CapabilityKind.EQUALITY_ONLY, CapabilityTemplate.of(template));
    }

    public static CapabilityDescriptor ordered(String capability) {
        return new CapabilityDescriptor(CapabilityKind.ORDERED, CapabilityTemplate.of(capability));
    }
}
