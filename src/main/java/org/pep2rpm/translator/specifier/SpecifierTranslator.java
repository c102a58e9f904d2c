package org.pep2rpm.translator.specifier;

import org.pep2rpm.translator.InvalidSpecifierOperatorException;
import org.pep2rpm.translator.version.Version;
import org.pep2rpm.translator.version.VersionOrderEncoder;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates PEP 440 specifier sets into RPM comparison clauses.
 * <p>
 * RPM has no prefix-match operator, so wildcard clauses are approximated by an exact comparison
 * against the prefix: {@code ==1.5.*} becomes {@code = 1.5} and {@code !=1.5.*} becomes
 * {@code < 1.5 or > 1.5}. Only the prefix version itself
 * matches, not its descendants.
 */
public class SpecifierTranslator {

    public static final String CLAUSE_SEPARATOR = ", ";

    private final VersionRendering rendering;
    private final VersionOrderEncoder encoder;

    /**
     * Creates a translator that copies versions into clauses as written.
     */
    public SpecifierTranslator() {
        this(VersionRendering.LITERAL, new VersionOrderEncoder());
    }

    /**
     * @param rendering How version operands are written into clauses.
     * @param encoder   The encoder used for {@link VersionRendering#ORDERED} rendering.
     */
    public SpecifierTranslator(VersionRendering rendering, VersionOrderEncoder encoder) {
        this.rendering = rendering;
        this.encoder = encoder;
    }

    /**
     * Translates every specifier of a set, in declaration order.
     * @param capability The RPM capability the clauses constrain, e.g. {@code python3-requests}.
     * @param specifiers The specifier set; an empty set yields no clauses.
     * @return The RPM clauses, one or two per specifier.
     * @throws InvalidSpecifierOperatorException if {@code ~=} is applied to a single-segment release.
     */
    public List<String> translate(String capability, SpecifierSet specifiers) {
        List<String> clauses = new ArrayList<>();
        for (VersionSpecifier specifier : specifiers) {
            clauses.addAll(translate(capability, specifier));
        }
        return clauses;
    }

    /**
     * Translates a set and joins the clauses with {@value #CLAUSE_SEPARATOR}.
     * @return The joined clauses, or the bare capability when the set is empty.
     */
    public String translateToText(String capability, SpecifierSet specifiers) {
        List<String> clauses = translate(capability, specifiers);
        return clauses.isEmpty() ? capability : String.join(CLAUSE_SEPARATOR, clauses);
    }

    /**
     * Translates a single specifier.
     * @param capability The RPM capability name.
     * @param specifier  The specifier.
     * @return The RPM clauses for this specifier.
     */
    public List<String> translate(String capability, VersionSpecifier specifier) {
        return switch (specifier.operator()) {
            case EQUAL, ARBITRARY_EQUAL -> List.of(clause(capability, "=", render(specifier)));
            case NOT_EQUAL -> {
                String version = render(specifier);
                yield List.of(clause(capability, "<", version) + " or " + clause(capability, ">", version));
            }
            case LESS, LESS_OR_EQUAL, GREATER, GREATER_OR_EQUAL ->
                    List.of(clause(capability, specifier.operator().symbol(), render(specifier)));
            case COMPATIBLE -> List.of(
                    clause(capability, ">=", render(specifier)),
                    clause(capability, "<", compatibleUpperBound(specifier)));
        };
    }

    private String render(VersionSpecifier specifier) {
        if (rendering == VersionRendering.ORDERED && specifier.operator() != SpecifierOperator.ARBITRARY_EQUAL) {
            return encoder.encode(specifier.parsedVersion());
        }
        return specifier.version().trim();
    }

    /**
     * The exclusive upper bound of {@code ~=V}: V's second-to-last release segment incremented,
     * later segments and any pre, post, dev or local parts dropped ({@code ~=1.5.3b7} gives {@code 1.6}).
     */
    private String compatibleUpperBound(VersionSpecifier specifier) {
        Version version = specifier.parsedVersion();
        if (version.release().size() < 2) {
            throw new InvalidSpecifierOperatorException(
                    "~= requires a release with at least two segments, got '" + specifier + "'",
                    specifier.toString());
        }
        Version bound = version.compatibleUpperBound();
        return rendering == VersionRendering.ORDERED ? encoder.encode(bound) : bound.toString();
    }

    private static String clause(String capability, String operator, String version) {
        return capability + " " + operator + " " + version;
    }

    public VersionRendering getRendering() {
        return rendering;
    }
}
