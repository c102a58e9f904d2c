package org.pep2rpm.translator.specifier;

/**
 * How {@link SpecifierTranslator} writes version operands into RPM clauses.
 */
public enum VersionRendering {
    /** The version exactly as written in the specifier. */
    LITERAL,
    /** The version encoded by {@link org.pep2rpm.translator.version.VersionOrderEncoder}. */
    ORDERED
}
