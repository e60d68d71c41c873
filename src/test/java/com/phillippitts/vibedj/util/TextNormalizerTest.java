package com.phillippitts.vibedj.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void shouldTrimAndLowercaseKeys() {
        assertThat(TextNormalizer.key("  So What ")).isEqualTo("so what");
        assertThat(TextNormalizer.key(null)).isEmpty();
    }

    @Test
    void shouldBuildTrackKeyFromNormalizedParts() {
        assertThat(TextNormalizer.trackKey(" Naima", "John COLTRANE "))
                .isEqualTo("naima|||john coltrane");
    }

    @Test
    void shouldFoldAccentsToAscii() {
        assertThat(TextNormalizer.asciiSafe("Beyoncé")).isEqualTo("Beyonce");
        assertThat(TextNormalizer.asciiSafe("Sigur Rós")).isEqualTo("Sigur Ros");
    }

    @Test
    void shouldDropCharactersWithoutAsciiEquivalent() {
        assertThat(TextNormalizer.asciiSafe("坂本 Ryuichi")).isEqualTo(" Ryuichi");
        assertThat(TextNormalizer.asciiSafe("")).isEmpty();
        assertThat(TextNormalizer.asciiSafe(null)).isEmpty();
    }

    @Test
    void shouldCombineFoldingAndKeyNormalization() {
        assertThat(TextNormalizer.asciiKey(" Mötley Crüe ")).isEqualTo("motley crue");
    }
}
