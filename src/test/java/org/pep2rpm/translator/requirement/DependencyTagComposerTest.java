package org.pep2rpm.translator.requirement;

import org.pep2rpm.translator.capability.CapabilityTemplate;
import org.pep2rpm.translator.capability.DynamicVariableMapping;
import org.pep2rpm.translator.marker.MarkerEnvironment;
import org.pep2rpm.translator.marker.MarkerEvaluator;
import org.pep2rpm.translator.specifier.SpecifierTranslator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DependencyTagComposerTest {

    private static final PackageDependencies DEPENDENCIES = new PackageDependencies(
            List.of("setuptools>=40.8.0", "wheel"),
            List.of("idna (>=2.5)", "click ; extra == \"cli\"", "pysocks (!=1.5.7) ; extra == \"socks\""),
            List.of("cli", "socks"),
            ">=3.7");

    private final SpecifierTranslator translator = new SpecifierTranslator();
    private final RequirementConverter converter = new RequirementConverter(
            CapabilityTemplate.of("python-{name}"),
            new MarkerEvaluator(MarkerEnvironment.linuxCPython(),
                    DynamicVariableMapping.defaults("python({arch})", "python(abi)")),
            translator);

    private List<String> render(DependencyTagSettings settings, PackageDependencies dependencies) {
        return new DependencyTagComposer(converter, translator, settings).compose(dependencies).stream()
                .map(DependencyTag::render)
                .toList();
    }

    private static DependencyTagSettings settings(boolean extract, List<String> requiresExtras,
                                                  String optionalTag, String pythonVersion) {
        return new DependencyTagSettings(extract, List.of("rpm-static"), List.of(), requiresExtras,
                List.of("*"), optionalTag, pythonVersion, "python(abi)");
    }

    @Test
    void composesAllTags() {
        List<String> lines = render(settings(true, List.of("cli"), "Suggests", null), DEPENDENCIES);

        assertThat(lines).containsExactly(
                "BuildRequires: python-setuptools >= 40.8.0, python-wheel",
                "Requires: rpm-static, python-idna >= 2.5, python-click, python(abi) >= 3.7",
                "Suggests: python-pysocks < 1.5.7 or python-pysocks > 1.5.7");
    }

    @Test
    void pythonVersionOverridesRequiresPython() {
        List<String> lines = render(settings(true, List.of(), "", ">=3.9"), DEPENDENCIES);

        assertThat(lines).contains("Requires: rpm-static, python-idna >= 2.5, python(abi) >= 3.9");
    }

    @Test
    void blankOptionalTagDisablesSuggestions() {
        List<String> lines = render(settings(true, List.of(), " ", null), DEPENDENCIES);

        assertThat(lines).noneMatch(line -> line.startsWith("Suggests"));
    }

    @Test
    void customOptionalTag() {
        List<String> lines = render(settings(true, List.of(), "Recommends", null), DEPENDENCIES);

        assertThat(lines).contains("Recommends: python-click, python-pysocks < 1.5.7 or python-pysocks > 1.5.7");
    }

    @Test
    void extractionCanBeDisabled() {
        List<String> lines = render(settings(false, List.of("*"), "Suggests", null), DEPENDENCIES);

        assertThat(lines).containsExactly(
                "BuildRequires: python-setuptools >= 40.8.0, python-wheel",
                "Requires: rpm-static, python(abi) >= 3.7");
    }

    @Test
    void emptyTagsAreOmitted() {
        DependencyTagSettings bare = new DependencyTagSettings(true, List.of(), List.of(), List.of(), List.of(),
                "Suggests", null, "python(abi)");

        List<DependencyTag> tags = new DependencyTagComposer(converter, translator, bare)
                .compose(new PackageDependencies(List.of(), List.of(), List.of(), null));

        assertThat(tags).isEmpty();
    }

    @Test
    void selectsExtrasByGlobInProvidedOrder() {
        assertThat(DependencyTagComposer.selectExtras(List.of("testing", "docs", "test"), List.of("test*")))
                .containsExactly("testing", "test");
        assertThat(DependencyTagComposer.selectExtras(List.of("a", "b"), List.of("*")))
                .containsExactly("a", "b");
        assertThat(DependencyTagComposer.selectExtras(List.of("a", "b"), List.of())).isEmpty();
    }
}
