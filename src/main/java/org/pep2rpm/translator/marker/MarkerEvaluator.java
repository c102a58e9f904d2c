package org.pep2rpm.translator.marker;

import org.pep2rpm.translator.InvalidSpecifierOperatorException;
import org.pep2rpm.translator.Names;
import org.pep2rpm.translator.UnsupportedMarkerVariableException;
import org.pep2rpm.translator.capability.CapabilityDescriptor;
import org.pep2rpm.translator.capability.DynamicVariableMapping;
import org.pep2rpm.translator.marker.ast.MarkerAnd;
import org.pep2rpm.translator.marker.ast.MarkerComparison;
import org.pep2rpm.translator.marker.ast.MarkerExpression;
import org.pep2rpm.translator.marker.ast.MarkerOperator;
import org.pep2rpm.translator.marker.ast.MarkerOr;
import org.pep2rpm.translator.marker.TranslationResult.Condition;
import org.pep2rpm.translator.version.Version;
import org.pep2rpm.translator.version.VersionParser;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Evaluates environment markers with three-valued logic.
 * <p>
 * Variables bound in the {@link MarkerEnvironment} and the {@code extra} variable evaluate to
 * static booleans. Variables listed in the {@link DynamicVariableMapping} become RPM conditions
 * ({@code with ...} / {@code without ...}) that the package manager resolves at install time.
 * {@code and}/{@code or} nodes short-circuit on static operands, so statically known facts prune
 * whole subtrees and only the install-time part of a marker survives.
 * <p>
 * Evaluation never mutates its inputs; an evaluator can be shared between threads.
 */
public class MarkerEvaluator {

    public static final String EXTRA = "extra";

    private final MarkerEnvironment environment;
    private final DynamicVariableMapping dynamicMapping;

    public MarkerEvaluator(MarkerEnvironment environment, DynamicVariableMapping dynamicMapping) {
        this.environment = environment;
        this.dynamicMapping = dynamicMapping;
    }

    /**
     * One-shot evaluation with explicit collaborators.
     * @see #evaluate(MarkerExpression, Set)
     */
    public static TranslationResult evaluate(MarkerExpression expression, MarkerEnvironment environment,
                                             Set<String> extras, DynamicVariableMapping dynamicMapping) {
        return new MarkerEvaluator(environment, dynamicMapping).evaluate(expression, extras);
    }

    /**
     * Evaluates a marker expression.
     * @param expression The parsed marker.
     * @param extras     The active extras; names are compared after PEP 685 normalization.
     * @return A static boolean, or the RPM condition left once static facts are applied.
     * @throws UnsupportedMarkerVariableException if a variable is neither known nor mapped.
     * @throws InvalidSpecifierOperatorException if an operator cannot be applied to a variable.
     */
    public TranslationResult evaluate(MarkerExpression expression, Set<String> extras) {
        Set<String> normalizedExtras = extras.stream().map(Names::normalize).collect(Collectors.toSet());
        return evaluateNode(expression, normalizedExtras);
    }

    private TranslationResult evaluateNode(MarkerExpression expression, Set<String> extras) {
        if (expression instanceof MarkerAnd conjunction) {
            TranslationResult left = evaluateNode(conjunction.left(), extras);
            if (left.isFalse()) {
                return TranslationResult.FALSE;
            }
            return and(left, evaluateNode(conjunction.right(), extras));
        }
        if (expression instanceof MarkerOr disjunction) {
            TranslationResult left = evaluateNode(disjunction.left(), extras);
            if (left.isTrue()) {
                return TranslationResult.TRUE;
            }
            return or(left, evaluateNode(disjunction.right(), extras));
        }
        return evaluateComparison((MarkerComparison) expression, extras);
    }

    /**
     * Three-valued conjunction. Two conditions are juxtaposed, which RPM reads as a conjunction.
     */
    static TranslationResult and(TranslationResult left, TranslationResult right) {
        if (left.isFalse() || right.isFalse()) return TranslationResult.FALSE;
        if (left.isTrue()) return right;
        if (right.isTrue()) return left;
        return TranslationResult.condition(((Condition) left).text() + " " + ((Condition) right).text());
    }

    /**
     * Three-valued disjunction.
     */
    static TranslationResult or(TranslationResult left, TranslationResult right) {
        if (left.isTrue() || right.isTrue()) return TranslationResult.TRUE;
        if (left.isFalse()) return right;
        if (right.isFalse()) return left;
        return TranslationResult.condition(((Condition) left).text() + " or " + ((Condition) right).text());
    }

    private TranslationResult evaluateComparison(MarkerComparison leaf, Set<String> extras) {
        String variable = leaf.variable();
        if (EXTRA.equals(variable)) {
            return evaluateExtra(leaf, extras);
        }
        if (environment.isKnown(variable)) {
            return TranslationResult.of(evaluateKnown(leaf, environment.get(variable).orElseThrow()));
        }
        CapabilityDescriptor descriptor = dynamicMapping.get(variable)
                .orElseThrow(() -> new UnsupportedMarkerVariableException(variable));
        return evaluateDynamic(leaf, descriptor);
    }

    private static TranslationResult evaluateExtra(MarkerComparison leaf, Set<String> extras) {
        boolean member = extras.contains(Names.normalize(leaf.literal()));
        return switch (leaf.operator()) {
            case EQUAL, ARBITRARY_EQUAL, IN -> TranslationResult.of(member);
            case NOT_EQUAL, NOT_IN -> TranslationResult.of(!member);
            default -> throw unsupportedOperator(leaf, "extras can only be tested for membership");
        };
    }

    private static boolean evaluateKnown(MarkerComparison leaf, String value) {
        String lhs = leaf.literalFirst() ? leaf.literal() : value;
        String rhs = leaf.literalFirst() ? value : leaf.literal();
        return switch (leaf.operator()) {
            case EQUAL -> bothVersions(lhs, rhs) ? compareVersions(lhs, rhs) == 0 : lhs.equals(rhs);
            case NOT_EQUAL -> bothVersions(lhs, rhs) ? compareVersions(lhs, rhs) != 0 : !lhs.equals(rhs);
            case ARBITRARY_EQUAL -> lhs.equals(rhs);
            case IN -> rhs.contains(lhs);
            case NOT_IN -> !rhs.contains(lhs);
            case LESS -> compareOrdered(lhs, rhs) < 0;
            case LESS_OR_EQUAL -> compareOrdered(lhs, rhs) <= 0;
            case GREATER -> compareOrdered(lhs, rhs) > 0;
            case GREATER_OR_EQUAL -> compareOrdered(lhs, rhs) >= 0;
            case COMPATIBLE -> isCompatible(lhs, rhs, leaf);
        };
    }

    private static TranslationResult evaluateDynamic(MarkerComparison leaf, CapabilityDescriptor descriptor) {
        MarkerOperator operator = leaf.literalFirst() ? leaf.operator().mirrored() : leaf.operator();
        String literal = leaf.literal();
        return switch (descriptor.kind()) {
            case EQUALITY_ONLY -> switch (operator) {
                case EQUAL -> TranslationResult.condition("with " + descriptor.template().format(literal));
                case NOT_EQUAL -> TranslationResult.condition("without " + descriptor.template().format(literal));
                default -> throw unsupportedOperator(leaf, "'" + leaf.variable() + "' only supports == and !=");
            };
            case ORDERED -> {
                String capability = descriptor.template().text();
                if (operator.isOrdering()) {
                    yield TranslationResult.condition("with " + capability + " " + operator.symbol() + " " + literal);
                }
                yield switch (operator) {
                    case EQUAL -> TranslationResult.condition("with " + capability + " = " + literal);
                    case NOT_EQUAL -> TranslationResult.condition("without " + capability + " = " + literal);
                    case COMPATIBLE -> TranslationResult.condition("with " + capability + " >= " + literal
                            + " with " + capability + " < " + compatibleUpperBound(literal, leaf));
                    default -> throw unsupportedOperator(leaf,
                            "'" + leaf.variable() + "' only supports ==, !=, <, <=, >, >= and ~=");
                };
            }
        };
    }

    private static boolean bothVersions(String lhs, String rhs) {
        return VersionParser.isValid(lhs) && VersionParser.isValid(rhs);
    }

    private static int compareVersions(String lhs, String rhs) {
        return VersionParser.parse(lhs).compareTo(VersionParser.parse(rhs));
    }

    /** Orders two values as versions when both parse as one, lexically otherwise. */
    private static int compareOrdered(String lhs, String rhs) {
        return bothVersions(lhs, rhs) ? compareVersions(lhs, rhs) : lhs.compareTo(rhs);
    }

    private static boolean isCompatible(String lhs, String rhs, MarkerComparison leaf) {
        Version candidate = VersionParser.parse(lhs);
        Version base = VersionParser.parse(rhs);
        return candidate.compareTo(base) >= 0 && candidate.compareTo(upperBound(base, leaf)) < 0;
    }

    private static Version compatibleUpperBound(String literal, MarkerComparison leaf) {
        return upperBound(VersionParser.parse(literal), leaf);
    }

    private static Version upperBound(Version base, MarkerComparison leaf) {
        if (base.release().size() < 2) {
            throw unsupportedOperator(leaf, "~= requires a release with at least two segments");
        }
        return base.compatibleUpperBound();
    }

    private static InvalidSpecifierOperatorException unsupportedOperator(MarkerComparison leaf, String reason) {
        return new InvalidSpecifierOperatorException(
                "Operator '" + leaf.operator().symbol() + "' cannot be translated: " + reason, leaf.toString());
    }
}
