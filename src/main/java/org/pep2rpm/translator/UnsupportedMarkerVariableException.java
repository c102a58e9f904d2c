package org.pep2rpm.translator;

/**
 * Thrown when a marker references a variable that is neither bound in the marker environment nor
 * mapped to an RPM capability.
 */
public class UnsupportedMarkerVariableException extends TranslationException {

    private final String variable;

    public UnsupportedMarkerVariableException(String variable) {
        super("Marker variable '" + variable + "' is neither a known environment value nor mapped to an RPM capability",
                variable);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
