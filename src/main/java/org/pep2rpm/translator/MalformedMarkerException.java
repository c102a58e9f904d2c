package org.pep2rpm.translator;

/**
 * Thrown when an environment marker does not follow the PEP 508 marker grammar.
 */
public class MalformedMarkerException extends TranslationException {

    private final int column;

    /**
     * @param message Description of the syntax error
     * @param marker  The full marker text
     * @param column  Zero-based column of the offending token
     */
    public MalformedMarkerException(String message, String marker, int column) {
        super(message + " at column " + column + " in marker '" + marker + "'", marker);
        this.column = column;
    }

    public int getColumn() {
        return column;
    }
}
