package org.pep2rpm.translator;

/**
 * Thrown when a version literal is not a valid PEP 440 version.
 */
public class MalformedVersionException extends TranslationException {

    public MalformedVersionException(String version) {
        super("Invalid PEP 440 version: '" + version + "'", version);
    }

    public MalformedVersionException(String version, Throwable cause) {
        super("Invalid PEP 440 version: '" + version + "'", version, cause);
    }
}
