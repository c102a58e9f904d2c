package org.pep2rpm.translator.specifier;

import org.pep2rpm.translator.InvalidSpecifierOperatorException;
import org.pep2rpm.translator.MalformedVersionException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SpecifierParserTest {

    @Test
    void keepsDeclarationOrder() {
        SpecifierSet set = SpecifierParser.parse("!=2.0.4, !=2.1.2,>=2.0.1");

        assertThat(set.size()).isEqualTo(3);
        assertThat(set.specifiers()).extracting(VersionSpecifier::operator)
                .containsExactly(SpecifierOperator.NOT_EQUAL, SpecifierOperator.NOT_EQUAL,
                        SpecifierOperator.GREATER_OR_EQUAL);
        assertThat(set.specifiers()).extracting(VersionSpecifier::version)
                .containsExactly("2.0.4", "2.1.2", "2.0.1");
    }

    @Test
    void blankTextIsEmptySet() {
        assertThat(SpecifierParser.parse("")).isSameAs(SpecifierSet.EMPTY);
        assertThat(SpecifierParser.parse("   ").isEmpty()).isTrue();
        assertThat(SpecifierParser.parse(null).isEmpty()).isTrue();
    }

    @Test
    void recognizesWildcard() {
        VersionSpecifier specifier = SpecifierParser.parse("== 1.5.*").specifiers().get(0);

        assertThat(specifier.wildcard()).isTrue();
        assertThat(specifier.version()).isEqualTo("1.5");
        assertThat(specifier).hasToString("==1.5.*");
    }

    @Test
    void arbitraryEqualityTakesAnyOperand() {
        VersionSpecifier specifier = SpecifierParser.parse("===foobar").specifiers().get(0);

        assertThat(specifier.operator()).isEqualTo(SpecifierOperator.ARBITRARY_EQUAL);
        assertThat(specifier.version()).isEqualTo("foobar");
    }

    @ParameterizedTest
    @ValueSource(strings = {"=1.0", "=>1.0", "<>1.0", "1.0", ">=1.0.*", "~=1.0.*", "~=1", ">=1.0,", "== 1.0 2.0"})
    void rejectsInvalidClauses(String text) {
        assertThatThrownBy(() -> SpecifierParser.parse(text))
                .isInstanceOf(InvalidSpecifierOperatorException.class);
    }

    @Test
    void unknownOperatorIsNamed() {
        assertThatThrownBy(() -> SpecifierParser.parse("=1.0"))
                .isInstanceOf(InvalidSpecifierOperatorException.class)
                .hasMessageContaining("Unknown version operator '='");
    }

    @Test
    void rejectsMalformedVersion() {
        assertThatThrownBy(() -> SpecifierParser.parse(">=abc"))
                .isInstanceOf(MalformedVersionException.class);
        assertThatThrownBy(() -> SpecifierParser.parse("==1.0a1.*"))
                .isInstanceOf(MalformedVersionException.class);
    }
}
