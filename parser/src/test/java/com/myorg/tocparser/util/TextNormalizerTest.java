package com.myorg.tocparser.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void cleansExtractionArtifacts() {
        assertThat(TextNormalizer.normalize("\u00A0제1장\u200B ")).isEqualTo("제1장");
        assertThat(TextNormalizer.normalize("적용기준\u00A0\u00A0\u00A03")).isEqualTo("적용기준   3");
        assertThat(TextNormalizer.normalize("1-1\t일반사항")).isEqualTo("1-1 일반사항");
        assertThat(TextNormalizer.normalize(null)).isEmpty();
    }

    @Test
    void keepsInteriorSpaceRuns() {
        assertThat(TextNormalizer.normalize("적용기준    3")).isEqualTo("적용기준    3");
    }

    @Test
    void composesDecomposedHangul() {
        String decomposed = "\u1106\u1169\u11A8 \u110E\u1161";
        assertThat(TextNormalizer.normalize(decomposed)).isEqualTo("목 차");
    }

    @Test
    void pageNumbers() {
        assertThat(PageNumbers.isBareInteger(" 12 ")).isTrue();
        assertThat(PageNumbers.isBareInteger("12쪽")).isFalse();
        assertThat(PageNumbers.isBareInteger(null)).isFalse();
        assertThat(PageNumbers.safeParseInt("x")).isZero();
        assertThat(PageNumbers.safeParseInt("047")).isEqualTo(47);
    }
}
