package org.pep2rpm.translator;

/**
 * Thrown when an operator is unknown, or cannot be applied to its operand in the context it is
 * used (e.g. {@code ~=} on a single-segment release, or an ordering comparison on an
 * equality-only marker capability).
 */
public class InvalidSpecifierOperatorException extends TranslationException {

    public InvalidSpecifierOperatorException(String message, String input) {
        super(message, input);
    }
}
