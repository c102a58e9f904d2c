package org.pep2rpm.translator.marker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The marker variables whose values are known when translating, e.g. {@code os_name = posix}
 * for every RPM-based system. Immutable.
 */
public final class MarkerEnvironment {

    private final Map<String, String> values;

    private MarkerEnvironment(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static MarkerEnvironment of(Map<String, String> values) {
        return new MarkerEnvironment(values);
    }

    /**
     * The values shared by every Linux distribution using CPython.
     */
    public static MarkerEnvironment linuxCPython() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("os_name", "posix");
        values.put("sys_platform", "linux");
        values.put("platform_system", "Linux");
        values.put("implementation_name", "cpython");
        values.put("platform_python_implementation", "CPython");
        return new MarkerEnvironment(values);
    }

    public Optional<String> get(String variable) {
        return Optional.ofNullable(values.get(variable));
    }

    public boolean isKnown(String variable) {
        return values.containsKey(variable);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
