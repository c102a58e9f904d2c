package org.pep2rpm.translator.version;

/**
 * The pre-release part of a version, e.g. {@code rc2}.
 *
 * @param phase  The pre-release phase.
 * @param number The pre-release number, 0 when omitted in the literal.
 */
public record PreRelease(PrePhase phase, long number) {

    @Override
    public String toString() {
        return phase.label() + number;
    }
}
