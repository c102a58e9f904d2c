package org.pep2rpm.translator.version;

import java.util.Comparator;

/**
 * Compares RPM version labels the way RPM itself does.
 * <p>
 * A label has the form {@code [epoch:]version[-release]}. Epochs compare numerically (absent
 * means 0), then version and release fields are compared with {@link #compareSegments(String, String)},
 * RPM's {@code rpmvercmp} algorithm. The release is only compared when both labels carry one.
 */
public final class RpmLabelComparator implements Comparator<String> {

    public static final RpmLabelComparator INSTANCE = new RpmLabelComparator();

    @Override
    public int compare(String left, String right) {
        Label a = Label.parse(left);
        Label b = Label.parse(right);

        int result = Version.compareNumeric(a.epoch(), b.epoch());
        if (result != 0) return result;

        result = compareSegments(a.version(), b.version());
        if (result != 0) return result;

        if (a.release() != null && b.release() != null) {
            return compareSegments(a.release(), b.release());
        }
        return 0;
    }

    /**
     * RPM's {@code rpmvercmp}: splits both strings into runs of digits and runs of letters,
     * ignoring every other character except {@code ~} and {@code ^}.
     * <ul>
     *   <li>{@code ~} sorts before anything, even the end of the string.</li>
     *   <li>{@code ^} sorts after the end of the string but before anything else.</li>
     *   <li>Numeric runs compare numerically and are newer than alphabetic runs.</li>
     *   <li>Alphabetic runs compare with {@code strcmp}.</li>
     *   <li>When all runs are equal, the string with characters left over is newer.</li>
     * </ul>
     * @return a negative number, zero or a positive number as {@code a} is older than, equal to
     *         or newer than {@code b}.
     */
    public static int compareSegments(String a, String b) {
        if (a.equals(b)) return 0;

        int i = 0;
        int j = 0;
        while (i < a.length() || j < b.length()) {
            while (i < a.length() && isSeparator(a.charAt(i))) i++;
            while (j < b.length() && isSeparator(b.charAt(j))) j++;

            boolean tildeA = i < a.length() && a.charAt(i) == '~';
            boolean tildeB = j < b.length() && b.charAt(j) == '~';
            if (tildeA || tildeB) {
                if (!tildeA) return 1;
                if (!tildeB) return -1;
                i++;
                j++;
                continue;
            }

            boolean caretA = i < a.length() && a.charAt(i) == '^';
            boolean caretB = j < b.length() && b.charAt(j) == '^';
            if (caretA || caretB) {
                if (i >= a.length()) return -1;
                if (j >= b.length()) return 1;
                if (!caretA) return 1;
                if (!caretB) return -1;
                i++;
                j++;
                continue;
            }

            if (i >= a.length() || j >= b.length()) break;

            int startA = i;
            int startB = j;
            boolean numeric = isDigit(a.charAt(i));
            if (numeric) {
                while (i < a.length() && isDigit(a.charAt(i))) i++;
                while (j < b.length() && isDigit(b.charAt(j))) j++;
            } else {
                while (i < a.length() && isAlpha(a.charAt(i))) i++;
                while (j < b.length() && isAlpha(b.charAt(j))) j++;
            }

            // Segments of different types: the numeric one is newer.
            if (startB == j) return numeric ? 1 : -1;

            String segA = a.substring(startA, i);
            String segB = b.substring(startB, j);
            int result = numeric
                    ? Version.compareNumeric(segA, segB)
                    : Integer.signum(segA.compareTo(segB));
            if (result != 0) return result;
        }

        if (i >= a.length() && j >= b.length()) return 0;
        return i < a.length() ? 1 : -1;
    }

    private static boolean isSeparator(char c) {
        return !isDigit(c) && !isAlpha(c) && c != '~' && c != '^';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * An RPM label split into its fields.
     *
     * @param epoch   The epoch digits, "0" when absent.
     * @param version The version field.
     * @param release The release field, or null.
     */
    record Label(String epoch, String version, String release) {

        static Label parse(String label) {
            String epoch = "0";
            String rest = label.trim();
            int colon = rest.indexOf(':');
            if (colon >= 0) {
                String digits = rest.substring(0, colon);
                epoch = digits.isEmpty() ? "0" : digits;
                rest = rest.substring(colon + 1);
            }
            String release = null;
            int dash = rest.lastIndexOf('-');
            if (dash >= 0) {
                release = rest.substring(dash + 1);
                rest = rest.substring(0, dash);
            }
            return new Label(epoch, rest, release);
        }
    }
}
