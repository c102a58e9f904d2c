package org.pep2rpm.translator.version;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the PEP 440 ordering of {@link Version}.
 */
@Tag("unit")
class VersionTest {

    /** Strictly increasing under PEP 440. */
    static final List<String> ORDERED_CORPUS = List.of(
            "0.9",
            "0.9.post1",
            "1.0.dev456",
            "1.0a1",
            "1.0a1+abc",
            "1.0a1.post1.dev1",
            "1.0a1.post1",
            "1.0a2.dev456",
            "1.0a12.dev456",
            "1.0a12",
            "1.0b1.dev456",
            "1.0b2",
            "1.0b2.post345.dev456",
            "1.0b2.post345",
            "1.0rc1.dev456",
            "1.0rc1",
            "1.0",
            "1.0+abc",
            "1.0+abc.5",
            "1.0+abc.7",
            "1.0+def",
            "1.0+5",
            "1.0+5.1",
            "1.0+10",
            "1.0.post456.dev34",
            "1.0.post456",
            "1.0.post456+local",
            "1.0.post457",
            "1.0.1",
            "1.0.15",
            "1.1.dev1",
            "1.1",
            "2.0",
            "10.0",
            "1!0.1",
            "1!1.0",
            "2!0.0.1");

    @Test
    void corpusIsStrictlyIncreasing() {
        for (int i = 1; i < ORDERED_CORPUS.size(); i++) {
            Version lower = Version.parse(ORDERED_CORPUS.get(i - 1));
            Version higher = Version.parse(ORDERED_CORPUS.get(i));
            assertThat(lower.compareTo(higher))
                    .describedAs("%s < %s", lower, higher)
                    .isNegative();
            assertThat(higher.compareTo(lower)).isPositive();
        }
    }

    @Test
    void sortingShuffledCorpusRestoresOrder() {
        List<Version> shuffled = new ArrayList<>();
        ORDERED_CORPUS.forEach(text -> shuffled.add(Version.parse(text)));
        Collections.shuffle(shuffled, new Random(42));

        Collections.sort(shuffled);

        assertThat(shuffled).extracting(Version::toString).containsExactlyElementsOf(ORDERED_CORPUS);
    }

    @Test
    void trailingZerosDoNotChangeOrder() {
        assertThat(Version.parse("1.0").compareTo(Version.parse("1.0.0"))).isZero();
        assertThat(Version.parse("1").compareTo(Version.parse("1.0.0.0"))).isZero();
        assertThat(Version.parse("1.0a1").compareTo(Version.parse("1.0.0a1"))).isZero();
    }

    @Test
    void localNumbersCompareNumerically() {
        assertThat(Version.parse("1.0+9").compareTo(Version.parse("1.0+10"))).isNegative();
        assertThat(Version.parse("1.0+007").compareTo(Version.parse("1.0+7"))).isZero();
    }

    @Test
    void normalizedReleasePadsAndTrims() {
        assertThat(Version.parse("5").normalizedRelease(2)).containsExactly(5L, 0L);
        assertThat(Version.parse("1.0.0").normalizedRelease(2)).containsExactly(1L, 0L);
        assertThat(Version.parse("1.2.0.3.0").normalizedRelease(2)).containsExactly(1L, 2L, 0L, 3L);
        assertThat(Version.parse("1.0.0").normalizedRelease(0)).containsExactly(1L);
    }

    @Test
    void compatibleUpperBoundIncrementsSecondToLastSegment() {
        assertThat(Version.parse("1.5.3b7").compatibleUpperBound()).hasToString("1.6");
        assertThat(Version.parse("3.6").compatibleUpperBound()).hasToString("4");
        assertThat(Version.parse("1!2.0.post1").compatibleUpperBound()).hasToString("1!3");
        assertThatThrownBy(() -> Version.parse("3").compatibleUpperBound())
                .isInstanceOf(IllegalStateException.class);
    }
}
