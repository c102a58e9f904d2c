package org.pep2rpm.translator.capability;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CapabilityTemplateTest {

    @Test
    void formatsPlaceholder() {
        CapabilityTemplate template = CapabilityTemplate.of("python3dist({name})");

        assertThat(template.isParameterized()).isTrue();
        assertThat(template.format("requests")).isEqualTo("python3dist(requests)");
    }

    @Test
    void repeatedPlaceholderGetsSameValue() {
        assertThat(CapabilityTemplate.of("{arch}-{arch}").format("x86_64")).isEqualTo("x86_64-x86_64");
    }

    @Test
    void fixedNameIgnoresValue() {
        CapabilityTemplate template = CapabilityTemplate.of("python(abi)");

        assertThat(template.isParameterized()).isFalse();
        assertThat(template.format("ignored")).isEqualTo("python(abi)");
    }

    @Test
    void valueIsInsertedLiterally() {
        assertThat(CapabilityTemplate.of("python-{name}").format("a$1\\b")).isEqualTo("python-a$1\\b");
    }

    @Test
    void rejectsBlankAndMultiplePlaceholders() {
        assertThatThrownBy(() -> CapabilityTemplate.of(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CapabilityTemplate.of("{name}-{arch}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("more than one placeholder");
    }

    @Test
    void descriptorValidatesKind() {
        assertThat(CapabilityDescriptor.equalityOnly("python({arch})").kind()).isEqualTo(CapabilityKind.EQUALITY_ONLY);
        assertThat(CapabilityDescriptor.ordered("kernel").kind()).isEqualTo(CapabilityKind.ORDERED);
        assertThatThrownBy(() -> CapabilityDescriptor.equalityOnly("kernel"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CapabilityDescriptor.ordered("python({arch})"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultMappingCoversDynamicVariables() {
        DynamicVariableMapping mapping = DynamicVariableMapping.defaults("python({arch})", "python(abi)");

        assertThat(mapping.asMap()).containsOnlyKeys(DynamicVariableMapping.PLATFORM_MACHINE,
                DynamicVariableMapping.PLATFORM_RELEASE, DynamicVariableMapping.PYTHON_VERSION);
        assertThat(mapping.get(DynamicVariableMapping.PLATFORM_RELEASE))
                .contains(CapabilityDescriptor.ordered("kernel"));
        assertThat(mapping.contains("os_name")).isFalse();
    }
}
