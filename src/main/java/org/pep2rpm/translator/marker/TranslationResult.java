package org.pep2rpm.translator.marker;

/**
 * The outcome of evaluating a marker: either a value known at translation time, or an RPM
 * boolean-dependency condition that the package manager resolves on the installing machine.
 * <p>
 * A statically false marker and an empty condition are different things; the sealed hierarchy
 * keeps them apart.
 */
public sealed interface TranslationResult permits TranslationResult.Static, TranslationResult.Condition {

    Static TRUE = new Static(true);
    Static FALSE = new Static(false);

    static Static of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Condition condition(String text) {
        return new Condition(text);
    }

    default boolean isTrue() {
        return this instanceof Static s && s.value();
    }

    default boolean isFalse() {
        return this instanceof Static s && !s.value();
    }

    /**
     * A marker whose value is known when translating.
     *
     * @param value The value.
     */
    record Static(boolean value) implements TranslationResult {
        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /**
     * A marker deferred to install time, e.g. {@code with python(x86-64)}.
     *
     * @param text The RPM condition, starting with {@code with} or {@code without}.
     */
    record Condition(String text) implements TranslationResult {
        public Condition {
            if (text == null || text.isBlank()) {
                throw new IllegalArgumentException("A condition must not be empty");
            }
        }

        @Override
        public String toString() {
            return text;
        }
    }
}
