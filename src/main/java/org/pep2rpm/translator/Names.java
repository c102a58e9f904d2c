package org.pep2rpm.translator;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Name normalization shared by project names (PEP 503) and extra names (PEP 685).
 */
public final class Names {

    private static final Pattern SEPARATOR_RUN = Pattern.compile("[-_.]+");

    private Names() {
    }

    /**
     * Lower-cases a name and collapses every run of {@code -}, {@code _} and {@code .} into a single {@code -}.
     * @param name The name as written, e.g. {@code Zope.Interface}.
     * @return The normalized name, e.g. {@code zope-interface}.
     */
    public static String normalize(String name) {
        return SEPARATOR_RUN.matcher(name.trim()).replaceAll("-").toLowerCase(Locale.ROOT);
    }
}
