package org.pep2rpm.translator.version;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A parsed PEP 440 version.
 * <p>
 * Instances are immutable and ordered according to PEP 440: epoch first, then the release
 * (compared as if padded with zeros), then development, pre, post releases and finally the local
 * label. Two versions that PEP 440 considers equal ({@code 1.0} and {@code 1.0.0}) compare as 0
 * but are not {@link #equals(Object) equal} records.
 *
 * @param epoch   The epoch, 0 when absent.
 * @param release The release segments, never empty.
 * @param pre     The pre-release, or null.
 * @param post    The post-release number, or null.
 * @param dev     The development release number, or null.
 * @param local   The lower-cased local label segments, empty when absent.
 */
public record Version(
        long epoch,
        List<Long> release,
        PreRelease pre,
        Long post,
        Long dev,
        List<String> local
) implements Comparable<Version> {

    public Version {
        release = List.copyOf(release);
        local = List.copyOf(local);
    }

    /**
     * Parses a PEP 440 version literal.
     * @param text The version literal.
     * @return The parsed version.
     * @throws org.pep2rpm.translator.MalformedVersionException if the literal is invalid.
     */
    public static Version parse(String text) {
        return VersionParser.parse(text);
    }

    public boolean isPreRelease() {
        return pre != null;
    }

    public boolean isPostRelease() {
        return post != null;
    }

    public boolean isDevRelease() {
        return dev != null;
    }

    public boolean hasLocal() {
        return !local.isEmpty();
    }

    /**
     * Returns the release segments without trailing zeros, keeping at least {@code minimum}
     * segments by padding with zeros.
     * @param minimum The minimum number of segments to return.
     * @return The normalized release segments.
     */
    public List<Long> normalizedRelease(int minimum) {
        int end = release.size();
        while (end > minimum && release.get(end - 1) == 0L) {
            end--;
        }
        List<Long> segments = new ArrayList<>(release.subList(0, end));
        while (segments.size() < minimum) {
            segments.add(0L);
        }
        return segments;
    }

    /**
     * The exclusive upper bound of {@code ~=} against this version: the second-to-last release
     * segment incremented, later segments and any pre, post, dev or local parts dropped
     * ({@code 1.5.3b7} gives {@code 1.6}, {@code 3.6} gives {@code 4}).
     * @return The bound, keeping this version's epoch.
     * @throws IllegalStateException if the release has fewer than two segments.
     */
    public Version compatibleUpperBound() {
        if (release.size() < 2) {
            throw new IllegalStateException("~= needs at least two release segments, got " + this);
        }
        List<Long> bound = new ArrayList<>(release.subList(0, release.size() - 1));
        bound.set(bound.size() - 1, bound.get(bound.size() - 1) + 1);
        return new Version(epoch, bound, null, null, null, List.of());
    }

    @Override
    public int compareTo(Version other) {
        int result = Long.compare(epoch, other.epoch);
        if (result != 0) return result;

        result = compareRelease(normalizedRelease(0), other.normalizedRelease(0));
        if (result != 0) return result;

        result = Integer.compare(preRank(), other.preRank());
        if (result != 0) return result;
        if (pre != null && other.pre != null) {
            result = pre.phase().compareTo(other.pre.phase());
            if (result != 0) return result;
            result = Long.compare(pre.number(), other.pre.number());
            if (result != 0) return result;
        }

        // An absent post release sorts before any post release.
        result = compareOptional(post, other.post, -1);
        if (result != 0) return result;

        // An absent dev release sorts after any dev release.
        result = compareOptional(dev, other.dev, 1);
        if (result != 0) return result;

        return compareLocal(local, other.local);
    }

    /**
     * Ranks the pre-release slot: a dev release of a final release sorts before every
     * pre-release, a final release after all of them.
     */
    private int preRank() {
        if (pre == null && post == null && dev != null) {
            return -1;
        }
        return pre == null ? 1 : 0;
    }

    private static int compareRelease(List<Long> left, List<Long> right) {
        int common = Math.min(left.size(), right.size());
        for (int i = 0; i < common; i++) {
            int result = Long.compare(left.get(i), right.get(i));
            if (result != 0) return result;
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int compareOptional(Long left, Long right, int absentRank) {
        if (left == null && right == null) return 0;
        if (left == null) return absentRank;
        if (right == null) return -absentRank;
        return Long.compare(left, right);
    }

    private static int compareLocal(List<String> left, List<String> right) {
        int common = Math.min(left.size(), right.size());
        for (int i = 0; i < common; i++) {
            String a = left.get(i);
            String b = right.get(i);
            boolean aNumeric = isNumeric(a);
            boolean bNumeric = isNumeric(b);
            int result;
            if (aNumeric && bNumeric) {
                result = compareNumeric(a, b);
            } else if (aNumeric != bNumeric) {
                // Numeric local segments sort after alphanumeric ones.
                result = aNumeric ? 1 : -1;
            } else {
                result = Integer.signum(a.compareTo(b));
            }
            if (result != 0) return result;
        }
        return Integer.compare(left.size(), right.size());
    }

    static boolean isNumeric(String segment) {
        if (segment.isEmpty()) return false;
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) return false;
        }
        return true;
    }

    static int compareNumeric(String a, String b) {
        String left = stripLeadingZeros(a);
        String right = stripLeadingZeros(b);
        if (left.length() != right.length()) {
            return Integer.compare(left.length(), right.length());
        }
        return Integer.signum(left.compareTo(right));
    }

    static String stripLeadingZeros(String digits) {
        int start = 0;
        while (start < digits.length() - 1 && digits.charAt(start) == '0') {
            start++;
        }
        return digits.substring(start);
    }

    /**
     * @return The normalized PEP 440 form of this version.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (epoch != 0) {
            sb.append(epoch).append('!');
        }
        sb.append(release.stream().map(String::valueOf).collect(Collectors.joining(".")));
        if (pre != null) {
            sb.append(pre);
        }
        if (post != null) {
            sb.append(".post").append(post);
        }
        if (dev != null) {
            sb.append(".dev").append(dev);
        }
        if (!local.isEmpty()) {
            sb.append('+').append(String.join(".", local));
        }
        return sb.toString();
    }
}
