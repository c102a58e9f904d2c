package org.pep2rpm.translator;

/**
 * Thrown when a local version label cannot be encoded so that RPM orders it the way PEP 440 does.
 * <p>
 * RPM splits version labels into runs of letters and runs of digits, while PEP 440 compares a
 * mixed segment such as {@code cu118} as a single string. Such segments have no safe encoding.
 */
public class InconsistentLocalSegmentException extends TranslationException {

    public InconsistentLocalSegmentException(String version, String segment) {
        super("Local version segment '" + segment + "' of '" + version
                + "' mixes letters and digits and cannot be ordered safely by RPM", version);
    }
}
