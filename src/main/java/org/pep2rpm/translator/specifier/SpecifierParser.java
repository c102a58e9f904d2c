package org.pep2rpm.translator.specifier;

import org.pep2rpm.translator.InvalidSpecifierOperatorException;
import org.pep2rpm.translator.MalformedVersionException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses PEP 440 specifier sets.
 */
public final class SpecifierParser {

    private static final Pattern CLAUSE_PATTERN = Pattern.compile("^([~=!<>]+)\\s*(\\S+)$");
    private static final String WILDCARD_SUFFIX = ".*";

    private SpecifierParser() {
    }

    /**
     * Parses a comma separated list of specifiers, keeping declaration order.
     * @param text The specifier list; null or blank yields {@link SpecifierSet#EMPTY}.
     * @return The parsed set.
     * @throws InvalidSpecifierOperatorException if an operator is unknown, a wildcard follows an
     *         operator other than {@code ==}/{@code !=}, or {@code ~=} has a single-segment release.
     * @throws MalformedVersionException if an operand is not a valid version.
     */
    public static SpecifierSet parse(String text) {
        if (text == null || text.isBlank()) {
            return SpecifierSet.EMPTY;
        }
        List<VersionSpecifier> specifiers = new ArrayList<>();
        for (String clause : text.split(",", -1)) {
            specifiers.add(parseClause(clause.trim(), text));
        }
        return new SpecifierSet(specifiers);
    }

    private static VersionSpecifier parseClause(String clause, String fullText) {
        Matcher m = CLAUSE_PATTERN.matcher(clause);
        if (!m.matches()) {
            throw new InvalidSpecifierOperatorException(
                    "Expected an operator followed by a version in '" + clause + "'", fullText);
        }
        SpecifierOperator operator = SpecifierOperator.fromSymbol(m.group(1));
        String operand = m.group(2);

        if (operator == SpecifierOperator.ARBITRARY_EQUAL) {
            return new VersionSpecifier(operator, operand, false);
        }

        boolean wildcard = operand.endsWith(WILDCARD_SUFFIX);
        if (wildcard) {
            if (!operator.allowsWildcard()) {
                throw new InvalidSpecifierOperatorException(
                        "Wildcard versions are only allowed with == and !=, not '" + clause + "'", fullText);
            }
            operand = operand.substring(0, operand.length() - WILDCARD_SUFFIX.length());
        }

        VersionSpecifier specifier = new VersionSpecifier(operator, operand, wildcard);
        // Validates the operand eagerly so that malformed versions surface at parse time.
        int releaseSegments = specifier.parsedVersion().release().size();
        if (operator == SpecifierOperator.COMPATIBLE && releaseSegments < 2) {
            throw new InvalidSpecifierOperatorException(
                    "~= requires a release with at least two segments, got '" + clause + "'", fullText);
        }
        return specifier;
    }
}
