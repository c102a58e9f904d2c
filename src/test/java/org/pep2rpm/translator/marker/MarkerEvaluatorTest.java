package org.pep2rpm.translator.marker;

import org.pep2rpm.translator.InvalidSpecifierOperatorException;
import org.pep2rpm.translator.UnsupportedMarkerVariableException;
import org.pep2rpm.translator.capability.DynamicVariableMapping;
import org.pep2rpm.translator.marker.parser.MarkerParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class MarkerEvaluatorTest {

    private final MarkerEvaluator evaluator = new MarkerEvaluator(
            MarkerEnvironment.linuxCPython(),
            DynamicVariableMapping.defaults("python({arch})", "python(abi)"));

    private TranslationResult evaluate(String marker, String... extras) {
        return evaluator.evaluate(MarkerParser.parse(marker), Set.of(extras));
    }

    @Test
    void staticFactsEvaluateToBooleans() {
        assertThat(evaluate("os_name == \"nt\"")).isEqualTo(TranslationResult.FALSE);
        assertThat(evaluate("os_name == \"posix\"")).isEqualTo(TranslationResult.TRUE);
        assertThat(evaluate("sys_platform != \"win32\"")).isEqualTo(TranslationResult.TRUE);
        assertThat(evaluate("\"linux\" in sys_platform")).isEqualTo(TranslationResult.TRUE);
        assertThat(evaluate("sys_platform not in \"win32 cygwin\"")).isEqualTo(TranslationResult.TRUE);
        assertThat(evaluate("implementation_name == \"cpython\" and platform_system == \"Linux\""))
                .isEqualTo(TranslationResult.TRUE);
    }

    @Test
    void extrasTestMembership() {
        assertThat(evaluate("extra == \"test\"")).isEqualTo(TranslationResult.FALSE);
        assertThat(evaluate("extra == \"test\"", "test")).isEqualTo(TranslationResult.TRUE);
        assertThat(evaluate("extra != \"test\"", "test")).isEqualTo(TranslationResult.FALSE);
        assertThat(evaluate("\"test\" == extra", "test")).isEqualTo(TranslationResult.TRUE);
    }

    @Test
    void extraNamesAreNormalized() {
        assertThat(evaluate("extra == \"Micro_Feature\"", "micro.feature")).isEqualTo(TranslationResult.TRUE);
    }

    @Test
    void extraRejectsOrderingOperators() {
        assertThatThrownBy(() -> evaluate("extra > \"test\""))
                .isInstanceOf(InvalidSpecifierOperatorException.class);
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', value = {
            "extra == \"micro\" or platform_machine == \"x86-64\" | with python(x86-64)",
            "platform_machine == \"x86-64\" and platform_release > \"3.4\" | with python(x86-64) with kernel > 3.4",
            "os_name == \"nt\" and platform_machine == \"x86-64\" or platform_release > \"3.4\" | with kernel > 3.4",
            "platform_machine != \"x86\" and platform_release > \"5.14\" | without python(x86) with kernel > 5.14",
            "python_version < \"3.4\" | with python(abi) < 3.4",
            "python_version >= \"3.8\" and os_name == \"posix\" | with python(abi) >= 3.8",
            "python_version ~= \"3.6\" | with python(abi) >= 3.6 with python(abi) < 4",
            "platform_release ~= \"5.14.2\" | with kernel >= 5.14.2 with kernel < 5.15",
            "platform_release == \"5.14\" | with kernel = 5.14",
            "platform_release != \"5.14\" | without kernel = 5.14",
            "\"3.4\" < platform_release | with kernel > 3.4",
            "\"3.4\" >= python_version | with python(abi) <= 3.4",
            "\"aarch64\" == platform_machine | with python(aarch64)",
            "platform_machine == \"x86_64\" or platform_machine == \"aarch64\" | with python(x86_64) or with python(aarch64)"
    })
    void dynamicVariablesBecomeConditions(String marker, String condition) {
        assertThat(evaluate(marker)).isEqualTo(TranslationResult.condition(condition));
    }

    @Test
    void staticOperandsPruneConditions() {
        assertThat(evaluate("platform_machine == \"x86\" and os_name == \"nt\"")).isEqualTo(TranslationResult.FALSE);
        assertThat(evaluate("platform_machine == \"x86\" or os_name == \"posix\"")).isEqualTo(TranslationResult.TRUE);
        assertThat(evaluate("platform_machine == \"x86\" and os_name == \"posix\""))
                .isEqualTo(TranslationResult.condition("with python(x86)"));
    }

    @Test
    void shortCircuitSkipsUnsupportedRightOperand() {
        assertThat(evaluate("os_name == \"nt\" and unknown_variable == \"x\"")).isEqualTo(TranslationResult.FALSE);
        assertThat(evaluate("os_name == \"posix\" or unknown_variable == \"x\"")).isEqualTo(TranslationResult.TRUE);
    }

    @Test
    void unsupportedVariableIsReported() {
        assertThatThrownBy(() -> evaluate("implementation_version == \"3.11\""))
                .isInstanceOf(UnsupportedMarkerVariableException.class)
                .hasMessageContaining("implementation_version")
                .extracting(e -> ((UnsupportedMarkerVariableException) e).getVariable())
                .isEqualTo("implementation_version");
    }

    @Test
    void equalityOnlyVariableRejectsOrdering() {
        assertThatThrownBy(() -> evaluate("platform_machine > \"x86\""))
                .isInstanceOf(InvalidSpecifierOperatorException.class)
                .hasMessageContaining("platform_machine");
    }

    @Test
    void orderedVariableRejectsMembership() {
        assertThatThrownBy(() -> evaluate("platform_release in \"5.14\""))
                .isInstanceOf(InvalidSpecifierOperatorException.class);
    }

    @Test
    void orderedVariableRejectsSingleSegmentCompatibleRelease() {
        assertThatThrownBy(() -> evaluate("python_version ~= \"3\""))
                .isInstanceOf(InvalidSpecifierOperatorException.class)
                .hasMessageContaining("at least two segments");
    }

    @Test
    void knownVariablesFallBackToStringOrdering() {
        assertThat(evaluate("os_name > \"a\"")).isEqualTo(TranslationResult.TRUE);
        assertThat(evaluate("os_name < \"a\"")).isEqualTo(TranslationResult.FALSE);
        assertThat(evaluate("platform_system >= \"Linux\"")).isEqualTo(TranslationResult.TRUE);
        assertThat(evaluate("sys_platform <= \"win32\"")).isEqualTo(TranslationResult.TRUE);
        assertThat(evaluate("\"a\" < os_name")).isEqualTo(TranslationResult.TRUE);
    }

    @Test
    void knownVariablesCompareAsVersions() {
        MarkerEnvironment environment = MarkerEnvironment.of(Map.of("python_full_version", "3.11.4"));
        DynamicVariableMapping none = DynamicVariableMapping.builder().build();

        assertThat(MarkerEvaluator.evaluate(MarkerParser.parse("python_full_version >= \"3.8\""), environment, Set.of(), none))
                .isEqualTo(TranslationResult.TRUE);
        assertThat(MarkerEvaluator.evaluate(MarkerParser.parse("python_full_version == \"3.11.4.0\""), environment, Set.of(), none))
                .isEqualTo(TranslationResult.TRUE);
        assertThat(MarkerEvaluator.evaluate(MarkerParser.parse("python_full_version ~= \"3.11.0\""), environment, Set.of(), none))
                .isEqualTo(TranslationResult.TRUE);
        assertThat(MarkerEvaluator.evaluate(MarkerParser.parse("python_full_version ~= \"3.10.0\""), environment, Set.of(), none))
                .isEqualTo(TranslationResult.FALSE);
        assertThat(MarkerEvaluator.evaluate(MarkerParser.parse("python_full_version === \"3.11.4.0\""), environment, Set.of(), none))
                .isEqualTo(TranslationResult.FALSE);
    }

    @Test
    void environmentWinsOverDynamicMapping() {
        MarkerEvaluator pinned = new MarkerEvaluator(
                MarkerEnvironment.of(Map.of("platform_machine", "x86_64")),
                DynamicVariableMapping.defaults("python({arch})", "python(abi)"));

        assertThat(pinned.evaluate(MarkerParser.parse("platform_machine == \"x86_64\""), Set.of()))
                .isEqualTo(TranslationResult.TRUE);
    }

    @Test
    void threeValuedTables() {
        TranslationResult condition = TranslationResult.condition("with a");

        assertThat(MarkerEvaluator.and(TranslationResult.TRUE, condition)).isEqualTo(condition);
        assertThat(MarkerEvaluator.and(condition, TranslationResult.FALSE)).isEqualTo(TranslationResult.FALSE);
        assertThat(MarkerEvaluator.or(TranslationResult.FALSE, condition)).isEqualTo(condition);
        assertThat(MarkerEvaluator.or(condition, TranslationResult.TRUE)).isEqualTo(TranslationResult.TRUE);
        assertThat(MarkerEvaluator.and(condition, TranslationResult.condition("without b")))
                .isEqualTo(TranslationResult.condition("with a without b"));
    }
}
