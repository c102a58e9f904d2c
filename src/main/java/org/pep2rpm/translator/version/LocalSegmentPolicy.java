package org.pep2rpm.translator.version;

/**
 * How {@link VersionOrderEncoder} treats local version labels whose segments mix letters and
 * digits, which RPM splits differently than PEP 440 compares them.
 */
public enum LocalSegmentPolicy {
    /** Reject such segments with an {@link org.pep2rpm.translator.InconsistentLocalSegmentException}. */
    STRICT,
    /** Encode them as written, accepting that RPM may order them differently. */
    BEST_EFFORT
}
