package com.ytscraper.crawl.text;

import com.ytscraper.crawl.options.ScraperConfigException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void entitiesAreDecodedForEveryEncoding() {
        for (TextEncoding encoding : TextEncoding.values()) {
            assertThat(normalizer.normalize("Tom &amp; Jerry&#39;s", encoding)).isEqualTo("Tom & Jerry's");
        }
    }

    @Test
    void asciiDropsEverythingOutsideSevenBits() {
        assertThat(normalizer.normalize("Caf\u00E9 \u2014 na\u00EFve \uD83C\uDFB5", TextEncoding.ASCII))
            .isEqualTo("Caf  nave ");
    }

    @Test
    void utf8ComposesDecomposedCharacters() {
        assertThat(normalizer.normalize("Cafe\u0301", TextEncoding.UTF_8)).isEqualTo("Caf\u00E9");
    }

    @Test
    void smartFoldsPunctuationAndAccentsToAsciiLookalikes() {
        String input = "\u201CCaf&eacute;\u201D \u2013 it\u2019s na\u00EFve\u2026";

        assertThat(normalizer.normalize(input, TextEncoding.SMART)).isEqualTo("\"Cafe\" - it's naive...");
    }

    @Test
    void smartKeepsCharactersWithoutAsciiForm() {
        assertThat(normalizer.normalize("\u30AC\u30F3\u30C0\u30E0", TextEncoding.SMART))
            .isEqualTo("\u30AC\u30F3\u30C0\u30E0");
    }

    @Test
    void nullPassesThrough() {
        assertThat(normalizer.normalize(null, TextEncoding.SMART)).isNull();
    }

    @Test
    void encodingOptionParsing() {
        assertThat(TextEncoding.fromOption("Smart")).isEqualTo(TextEncoding.SMART);
        assertThat(TextEncoding.fromOption(null)).isEqualTo(TextEncoding.UTF_8);
        assertThatThrownBy(() -> TextEncoding.fromOption("latin-1")).isInstanceOf(ScraperConfigException.class);
    }
}
