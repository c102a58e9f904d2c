package org.pep2rpm.translator.requirement;

import java.util.List;

/**
 * The dependency metadata of a Python distribution, as extracted by the caller.
 *
 * @param buildRequires  The build-system requirements ({@code pyproject.toml} {@code build-system.requires}).
 * @param requiresDist   The {@code Requires-Dist} entries.
 * @param providesExtra  The {@code Provides-Extra} entries.
 * @param requiresPython The {@code Requires-Python} specifier set, or null.
 */
public record PackageDependencies(
        List<String> buildRequires,
        List<String> requiresDist,
        List<String> providesExtra,
        String requiresPython
) {

    public PackageDependencies {
        buildRequires = List.copyOf(buildRequires);
        requiresDist = List.copyOf(requiresDist);
        providesExtra = List.copyOf(providesExtra);
    }
}
