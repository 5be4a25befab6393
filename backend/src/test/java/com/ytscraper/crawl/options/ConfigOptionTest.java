package com.ytscraper.crawl.options;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigOptionTest {

    @Test
    void keysResolveFromEitherSpelling() {
        assertThat(ConfigOption.fromKey("max_depth")).isEqualTo(ConfigOption.MAX_DEPTH);
        assertThat(ConfigOption.fromKey("max-depth")).isEqualTo(ConfigOption.MAX_DEPTH);
        assertThat(ConfigOption.fromKey("API_KEY")).isEqualTo(ConfigOption.API_KEY);
    }

    @Test
    void unknownKeyIsAConfigError() {
        assertThatThrownBy(() -> ConfigOption.fromKey("colour"))
            .isInstanceOf(ScraperConfigException.class)
            .hasMessageContaining("colour");
    }

    @Test
    void numberAcceptsSingleValueOrCommaList() {
        assertThat(ConfigOption.NUMBER.convert("5")).isEqualTo(5);
        assertThat(ConfigOption.NUMBER.convert("10, 3")).isEqualTo(List.of(10, 3));
    }

    @Test
    void integersMustBeNonNegative() {
        assertThatThrownBy(() -> ConfigOption.MAX_DEPTH.convert("-1"))
            .isInstanceOf(ScraperConfigException.class)
            .hasMessageContaining("negative");
        assertThatThrownBy(() -> ConfigOption.NUMBER.convert("3,-2"))
            .isInstanceOf(ScraperConfigException.class);
    }

    @Test
    void nonIntegerIsATypeMismatch() {
        assertThatThrownBy(() -> ConfigOption.MAX_DEPTH.convert("two"))
            .isInstanceOf(ScraperConfigException.class)
            .hasMessageContaining("Please provide an integer");
    }

    @Test
    void choicesAreCaseInsensitiveAndClosed() {
        assertThat(ConfigOption.ENCODING.convert("SMART")).isEqualTo("smart");
        assertThat(ConfigOption.SAFE_SEARCH.convert("moderate")).isEqualTo("moderate");
        assertThatThrownBy(() -> ConfigOption.OUTPUT_FORMAT.convert("xlsx"))
            .isInstanceOf(ScraperConfigException.class);
    }

    @Test
    void stringsAreStoredTrimmed() {
        assertThat(ConfigOption.OUTPUT_DIR.convert("  /tmp/out ")).isEqualTo("/tmp/out");
    }

    @Test
    void acceptsChecksAlreadyTypedValues() {
        assertThat(ConfigOption.NUMBER.accepts(List.of(3, 2))).isTrue();
        assertThat(ConfigOption.NUMBER.accepts(List.of())).isFalse();
        assertThat(ConfigOption.MAX_DEPTH.accepts(-1)).isFalse();
        assertThat(ConfigOption.MAX_DEPTH.accepts("1")).isFalse();
        assertThat(ConfigOption.ENCODING.accepts("ascii")).isTrue();
        assertThat(ConfigOption.ENCODING.accepts("latin-1")).isFalse();
    }
}
