package org.pep2rpm.translator.requirement;

import java.util.List;

/**
 * Settings of {@link DependencyTagComposer}.
 *
 * @param extractDependencies  Whether {@code Requires-Dist} entries are converted at all.
 * @param staticRequires       Clauses always added to {@code Requires}.
 * @param staticSuggests       Clauses always added to the optional dependency tag.
 * @param requiresExtras       Glob patterns of extras whose requirements become {@code Requires}.
 * @param suggestsExtras       Glob patterns of extras whose requirements become optional dependencies.
 * @param optionalTag          The optional dependency tag, e.g. {@code Suggests}; blank disables it.
 * @param pythonVersion        Interpreter specifier overriding {@code Requires-Python}, or null.
 * @param abiCapability        The interpreter ABI capability, e.g. {@code python(abi)}.
 */
public record DependencyTagSettings(
        boolean extractDependencies,
        List<String> staticRequires,
        List<String> staticSuggests,
        List<String> requiresExtras,
        List<String> suggestsExtras,
        String optionalTag,
        String pythonVersion,
        String abiCapability
) {

    public DependencyTagSettings {
        staticRequires = List.copyOf(staticRequires);
        staticSuggests = List.copyOf(staticSuggests);
        requiresExtras = List.copyOf(requiresExtras);
        suggestsExtras = List.copyOf(suggestsExtras);
    }

    /**
     * Extract dependencies, no extras, {@code Suggests} as optional tag, {@code python(abi)}.
     */
    public static DependencyTagSettings defaults() {
        return new DependencyTagSettings(true, List.of(), List.of(), List.of(), List.of(),
                "Suggests", null, "python(abi)");
    }
}
