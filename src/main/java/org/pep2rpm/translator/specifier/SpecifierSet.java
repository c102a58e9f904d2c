package org.pep2rpm.translator.specifier;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered, implicitly conjoined collection of version specifiers. Declaration order is kept
 * so that translated clauses come out in the order they were written.
 *
 * @param specifiers The specifiers in declaration order.
 */
public record SpecifierSet(List<VersionSpecifier> specifiers) implements Iterable<VersionSpecifier> {

    public static final SpecifierSet EMPTY = new SpecifierSet(List.of());

    public SpecifierSet {
        specifiers = List.copyOf(specifiers);
    }

    /**
     * Parses a comma separated specifier list such as {@code >=1.0, !=1.3.*}.
     * @param text The specifier text, may be blank.
     * @return The parsed set.
     */
    public static SpecifierSet parse(String text) {
        return SpecifierParser.parse(text);
    }

    public boolean isEmpty() {
        return specifiers.isEmpty();
    }

    public int size() {
        return specifiers.size();
    }

    @Override
    public Iterator<VersionSpecifier> iterator() {
        return specifiers.iterator();
    }

    @Override
    public String toString() {
        return specifiers.stream().map(VersionSpecifier::toString).collect(Collectors.joining(","));
    }
}
