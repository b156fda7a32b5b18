package com.contextkit.common.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SizeEstimatorTest {

    @Test
    void countsAsciiWords() {
        assertThat(SizeEstimator.estimate("hello world foo")).isEqualTo(3);
    }

    @Test
    void weighsWideCharsByOneAndAHalf() {
        assertThat(SizeEstimator.estimate("工作压力")).isEqualTo(6);
    }

    @Test
    void floorsOddWideCharCounts() {
        // 3 * 1.5 = 4.5
        assertThat(SizeEstimator.estimate("你好吗")).isEqualTo(4);
    }

    @Test
    void mixedTokensAreNotNarrowWords() {
        // "hi你好" is not ASCII-only, but its two ideographs still count
        assertThat(SizeEstimator.estimate("hi你好 there")).isEqualTo(4);
    }

    @Test
    void nullAndBlankAreZero() {
        assertThat(SizeEstimator.estimate(null)).isZero();
        assertThat(SizeEstimator.estimate("")).isZero();
        assertThat(SizeEstimator.estimate("   \n\t ")).isZero();
    }

    @Test
    void bracketedHeaderTokensCountAsWords() {
        assertThat(SizeEstimator.estimate("{Layer 2: Working Memory}")).isEqualTo(4);
    }

    @Test
    void fullWidthPunctuationIsNeitherWideNorNarrow() {
        assertThat(SizeEstimator.countWideChars("，。")).isZero();
        assertThat(SizeEstimator.countNarrowWords("，。")).isZero();
    }

    @Test
    void informationSeparatorsSplitWords() {
        assertThat(SizeEstimator.estimate("a\u001Cb")).isEqualTo(2);
        assertThat(SizeEstimator.estimate("one\u001Ftwo three")).isEqualTo(3);
        assertThat(SizeEstimator.estimate("\u001D\u001E")).isZero();
    }
}
