package org.pep2rpm.translator;

/**
 * Thrown when a requirement string does not follow the PEP 508 requirement grammar.
 */
public class MalformedRequirementException extends TranslationException {

    public MalformedRequirementException(String message, String requirement) {
        super(message + " in requirement '" + requirement + "'", requirement);
    }

    public MalformedRequirementException(String message, String requirement, Throwable cause) {
        super(message + " in requirement '" + requirement + "'", requirement, cause);
    }
}
