package org.pep2rpm.translator.specifier;

import org.pep2rpm.translator.version.Version;
import org.pep2rpm.translator.version.VersionParser;

/**
 * A single version specifier clause such as {@code >=1.2} or {@code !=2.0.*}.
 *
 * @param operator The comparison operator.
 * @param version  The version text as written, without the trailing {@code .*}.
 * @param wildcard Whether the clause ended with {@code .*}; only valid with {@code ==} and {@code !=}.
 */
public record VersionSpecifier(SpecifierOperator operator, String version, boolean wildcard) {

    /**
     * Parses the version operand. Wildcard operands are parsed as a release prefix.
     * Not available for {@code ===}, whose operand is an arbitrary string.
     * @return The parsed version.
     * @throws org.pep2rpm.translator.MalformedVersionException if the operand is not a valid version.
     */
    public Version parsedVersion() {
        return wildcard ? VersionParser.parseReleasePrefix(version) : VersionParser.parse(version);
    }

    @Override
    public String toString() {
        return operator.symbol() + version + (wildcard ? ".*" : "");
    }
}
