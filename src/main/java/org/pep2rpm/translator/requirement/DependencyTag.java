package org.pep2rpm.translator.requirement;

import java.util.List;

/**
 * A dependency tag of an RPM spec file with its clauses, e.g. {@code Requires: a, b}.
 *
 * @param tag     The tag name, e.g. {@code Requires}.
 * @param clauses The clauses in order.
 */
public record DependencyTag(String tag, List<String> clauses) {

    public static final String BUILD_REQUIRES = "BuildRequires";
    public static final String REQUIRES = "Requires";

    public DependencyTag {
        clauses = List.copyOf(clauses);
    }

    /**
     * @return The spec file line, e.g. {@code Requires: python3-foo >= 1.0, python(abi) >= 3.8}.
     */
    public String render() {
        return tag + ": " + String.join(", ", clauses);
    }

    @Override
    public String toString() {
        return render();
    }
}
