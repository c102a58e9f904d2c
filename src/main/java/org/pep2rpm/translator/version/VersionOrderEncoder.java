package org.pep2rpm.translator.version;

import org.pep2rpm.translator.InconsistentLocalSegmentException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Encodes PEP 440 versions into RPM version labels that RPM orders exactly as PEP 440 orders the
 * original versions.
 * <p>
 * Layout of an encoded label, for release {@code R}:
 * <pre>
 *   [E:]R                 final release, trailing zeros trimmed to two segments
 *   [E:]R~~devN           development release of R, below every pre-release of R
 *   [E:]R~aN[~devM]       pre-release (phases a, b, rc) and its development releases
 *   [E:]R[~aN].postN      post-release, above the release it follows
 *   [E:]R[~aN].postN~devM development release of a post-release
 *   ...^local.parts       local label, above the same label without it
 * </pre>
 * The tilde sorts before the end of a label and a double tilde before any single tilde
 * segment; the caret sorts after the end of a label but before any other continuation.
 * The labels never contain {@code -}, so they can be used as an RPM {@code Version} field.
 */
public class VersionOrderEncoder {

    private static final int MINIMUM_RELEASE_SEGMENTS = 2;

    private final LocalSegmentPolicy localSegmentPolicy;

    /**
     * Creates an encoder that rejects local labels it cannot order safely.
     */
    public VersionOrderEncoder() {
        this(LocalSegmentPolicy.STRICT);
    }

    public VersionOrderEncoder(LocalSegmentPolicy localSegmentPolicy) {
        this.localSegmentPolicy = localSegmentPolicy;
    }

    /**
     * Parses and encodes a version literal.
     * @param version A PEP 440 version literal.
     * @return The RPM label.
     * @throws org.pep2rpm.translator.MalformedVersionException if the literal is invalid.
     * @throws InconsistentLocalSegmentException if the local label cannot be encoded under the
     *         {@link LocalSegmentPolicy#STRICT} policy.
     */
    public String encode(String version) {
        return encode(VersionParser.parse(version));
    }

    /**
     * Encodes a parsed version.
     * @param version The version.
     * @return The RPM label.
     */
    public String encode(Version version) {
        StringBuilder sb = new StringBuilder();
        if (version.epoch() != 0) {
            sb.append(version.epoch()).append(':');
        }
        sb.append(joinRelease(version.normalizedRelease(MINIMUM_RELEASE_SEGMENTS)));

        if (version.isPreRelease()) {
            sb.append('~').append(version.pre().phase().label()).append(version.pre().number());
        }
        if (version.isPostRelease()) {
            sb.append(".post").append(version.post());
        }
        if (version.isDevRelease()) {
            boolean ofFinalRelease = !version.isPreRelease() && !version.isPostRelease();
            sb.append(ofFinalRelease ? "~~dev" : "~dev").append(version.dev());
        }
        if (version.hasLocal()) {
            sb.append('^').append(encodeLocal(version));
        }
        return sb.toString();
    }

    public LocalSegmentPolicy getLocalSegmentPolicy() {
        return localSegmentPolicy;
    }

    private String encodeLocal(Version version) {
        if (localSegmentPolicy == LocalSegmentPolicy.STRICT) {
            for (String segment : version.local()) {
                if (!isUniform(segment)) {
                    throw new InconsistentLocalSegmentException(version.toString(), segment);
                }
            }
        }
        return String.join(".", version.local());
    }

    /**
     * A segment is safe when RPM sees it as one run: all digits or all letters.
     */
    private static boolean isUniform(String segment) {
        return Version.isNumeric(segment) || segment.chars().allMatch(Character::isLetter);
    }

    private static String joinRelease(List<Long> release) {
        return release.stream().map(String::valueOf).collect(Collectors.joining("."));
    }
}
