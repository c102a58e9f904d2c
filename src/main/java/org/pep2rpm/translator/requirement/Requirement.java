package org.pep2rpm.translator.requirement;

import org.pep2rpm.translator.marker.ast.MarkerExpression;
import org.pep2rpm.translator.specifier.SpecifierSet;

import java.util.List;
import java.util.Optional;

/**
 * A parsed PEP 508 dependency specification.
 *
 * @param name       The project name as written.
 * @param extras     The extras requested from the dependency, as written.
 * @param specifiers The version specifiers, empty when unconstrained or given by URL.
 * @param url        The direct reference URL, or null.
 * @param marker     The environment marker, or null when the requirement always applies.
 */
public record Requirement(
        String name,
        List<String> extras,
        SpecifierSet specifiers,
        String url,
        MarkerExpression marker
) {

    public Requirement {
        extras = List.copyOf(extras);
    }

    /**
     * Parses a requirement string.
     * @see RequirementParser#parse(String)
     */
    public static Requirement parse(String text) {
        return RequirementParser.parse(text);
    }

    public Optional<MarkerExpression> markerExpression() {
        return Optional.ofNullable(marker);
    }

    public Optional<String> directUrl() {
        return Optional.ofNullable(url);
    }
}
