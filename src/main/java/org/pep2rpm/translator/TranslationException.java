package org.pep2rpm.translator;

/**
 * Base class of every failure raised while translating Python packaging metadata into RPM
 * dependency clauses.
 * <p>
 * Translation is a pure computation, so these failures are never retried: repeating the call with
 * the same input produces the same exception. The engine never catches its own failures; callers
 * decide whether a failure aborts a whole conversion or is tolerated per requirement.
 */
public class TranslationException extends RuntimeException {

    private final String input;

    /**
     * Creates a TranslationException.
     *
     * @param message Description of the failure
     * @param input   The offending input text, may be null when not applicable
     */
    public TranslationException(String message, String input) {
        super(message);
        this.input = input;
    }

    /**
     * Creates a TranslationException with an underlying cause.
     *
     * @param message Description of the failure
     * @param input   The offending input text, may be null when not applicable
     * @param cause   The underlying exception
     */
    public TranslationException(String message, String input, Throwable cause) {
        super(message, cause);
        this.input = input;
    }

    /**
     * @return The input text that could not be translated, or null.
     */
    public String getInput() {
        return input;
    }
}
