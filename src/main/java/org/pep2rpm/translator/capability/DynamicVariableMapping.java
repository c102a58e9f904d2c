package org.pep2rpm.translator.capability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps marker variables that can only be known on the installing machine to the RPM capabilities
 * that stand for them. The table is immutable once built and can be shared between threads.
 */
public final class DynamicVariableMapping {

    public static final String PLATFORM_MACHINE = "platform_machine";
    public static final String PLATFORM_RELEASE = "platform_release";
    public static final String PYTHON_VERSION = "python_version";

    private final Map<String, CapabilityDescriptor> descriptors;

    private DynamicVariableMapping(Map<String, CapabilityDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableMap(new LinkedHashMap<>(descriptors));
    }

    /**
     * The minimal mapping: {@code platform_machine} to an architecture-qualified capability,
     * {@code platform_release} to {@code kernel} and {@code python_version} to the interpreter ABI.
     * @param archTemplate The template for architecture capabilities, e.g. {@code python({arch})}.
     * @param abiCapability The interpreter ABI capability, e.g. {@code python(abi)}.
     */
    public static DynamicVariableMapping defaults(String archTemplate, String abiCapability) {
        return builder()
                .equalityOnly(PLATFORM_MACHINE, archTemplate)
                .ordered(PLATFORM_RELEASE, "kernel")
                .ordered(PYTHON_VERSION, abiCapability)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param variable The marker variable name.
     * @return The descriptor, or empty if the variable is not mapped.
     */
    public Optional<CapabilityDescriptor> get(String variable) {
        return Optional.ofNullable(descriptors.get(variable));
    }

    public boolean contains(String variable) {
        return descriptors.containsKey(variable);
    }

    public Map<String, CapabilityDescriptor> asMap() {
        return descriptors;
    }

    public static final class Builder {
        private final Map<String, CapabilityDescriptor> descriptors = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder equalityOnly(String variable, String template) {
            return put(variable, CapabilityDescriptor.equalityOnly(template));
        }

        public Builder ordered(String variable, String capability) {
            return put(variable, CapabilityDescriptor.ordered(capability));
        }

        public Builder put(String variable, CapabilityDescriptor descriptor) {
            descriptors.put(variable, descriptor);
            return this;
        }

        public DynamicVariableMapping build() {
            return new DynamicVariableMapping(descriptors);
        }
    }
}
