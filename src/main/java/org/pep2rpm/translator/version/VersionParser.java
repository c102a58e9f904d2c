package org.pep2rpm.translator.version;

import org.pep2rpm.translator.MalformedVersionException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses PEP 440 version literals, accepting every spelling the standard normalizes:
 * a leading {@code v}, long pre-release labels ({@code alpha}, {@code preview}), the
 * {@code rev}/{@code r} post-release labels, implicit post releases ({@code 1.0-1}),
 * omitted numbers and {@code -}/{@code _}/{@code .} separators.
 * <p>
 * Numeric components (epoch, release segments, pre, post and dev numbers) are held as signed
 * 64-bit {@code long}s. A component above {@link Long#MAX_VALUE}, such as the second segment of
 * {@code 1.99999999999999999999}, is rejected with a {@link MalformedVersionException}.
 */
public final class VersionParser {

    private static final Pattern VERSION_PATTERN = Pattern.compile(
            "v?"
            + "(?:(?<epoch>[0-9]+)!)?"
            + "(?<release>[0-9]+(?:\\.[0-9]+)*)"
            + "(?<pre>[-_.]?(?<preL>alpha|a|beta|b|preview|pre|c|rc)[-_.]?(?<preN>[0-9]+)?)?"
            + "(?<post>(?:-(?<postN1>[0-9]+))|(?:[-_.]?(?<postL>post|rev|r)[-_.]?(?<postN2>[0-9]+)?))?"
            + "(?<dev>[-_.]?(?<devL>dev)[-_.]?(?<devN>[0-9]+)?)?"
            + "(?:\\+(?<local>[a-z0-9]+(?:[-_.][a-z0-9]+)*))?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern RELEASE_PREFIX_PATTERN = Pattern.compile(
            "v?(?:(?<epoch>[0-9]+)!)?(?<release>[0-9]+(?:\\.[0-9]+)*)", Pattern.CASE_INSENSITIVE);

    private VersionParser() {
    }

    /**
     * Parses a full PEP 440 version literal.
     * @param text The literal, surrounding whitespace is ignored.
     * @return The parsed version.
     * @throws MalformedVersionException if the literal is not a valid PEP 440 version.
     */
    public static Version parse(String text) {
        if (text == null) {
            throw new MalformedVersionException("null");
        }
        Matcher m = VERSION_PATTERN.matcher(text.trim());
        if (!m.matches()) {
            throw new MalformedVersionException(text);
        }
        try {
            long epoch = m.group("epoch") != null ? Long.parseLong(m.group("epoch")) : 0L;
            List<Long> release = parseRelease(m.group("release"));

            PreRelease pre = null;
            if (m.group("pre") != null) {
                pre = new PreRelease(PrePhase.fromSpelling(m.group("preL")), parseNumber(m.group("preN")));
            }

            Long post = null;
            if (m.group("post") != null) {
                post = parseNumber(m.group("postN1") != null ? m.group("postN1") : m.group("postN2"));
            }

            Long dev = m.group("dev") != null ? parseNumber(m.group("devN")) : null;

            List<String> local = List.of();
            if (m.group("local") != null) {
                local = Arrays.asList(m.group("local").toLowerCase(Locale.ROOT).split("[-_.]"));
            }
            return new Version(epoch, release, pre, post, dev, local);
        } catch (NumberFormatException e) {
            throw new MalformedVersionException(text, e);
        }
    }

    /**
     * Parses the prefix of a wildcard specifier such as {@code 1.5} in {@code ==1.5.*}.
     * Only an optional epoch and release segments are allowed in a prefix.
     * @param text The prefix without the trailing {@code .*}.
     * @return A version holding the epoch and release of the prefix.
     * @throws MalformedVersionException if the prefix is not a release.
     */
    public static Version parseReleasePrefix(String text) {
        Matcher m = RELEASE_PREFIX_PATTERN.matcher(text.trim());
        if (!m.matches()) {
            throw new MalformedVersionException(text);
        }
        try {
            long epoch = m.group("epoch") != null ? Long.parseLong(m.group("epoch")) : 0L;
            return new Version(epoch, parseRelease(m.group("release")), null, null, null, List.of());
        } catch (NumberFormatException e) {
            throw new MalformedVersionException(text, e);
        }
    }

    /**
     * Checks whether a literal is a valid PEP 440 version without throwing.
     * @param text The literal.
     * @return true if {@link #parse(String)} would succeed.
     */
    public static boolean isValid(String text) {
        return text != null && VERSION_PATTERN.matcher(text.trim()).matches();
    }

    private static List<Long> parseRelease(String release) {
        List<Long> segments = new ArrayList<>();
        for (String segment : release.split("\\.")) {
            segments.add(Long.parseLong(segment));
        }
        return segments;
    }

    private static long parseNumber(String digits) {
        return digits == null ? 0L : Long.parseLong(digits);
    }
}
