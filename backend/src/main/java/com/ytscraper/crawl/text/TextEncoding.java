package com.ytscraper.crawl.text;

import com.ytscraper.crawl.options.ScraperConfigException;

import java.util.Locale;

public enum TextEncoding {
    ASCII("ascii"),
    UTF_8("utf-8"),
    SMART("smart");

    private final String optionValue;

    TextEncoding(String optionValue) {
        this.optionValue = optionValue;
    }

    public String optionValue() {
        return optionValue;
    }

    public static TextEncoding fromOption(String raw) {
        if (raw == null || raw.isBlank()) {
            return UTF_8;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TextEncoding encoding : values()) {
            if (encoding.optionValue.equals(normalized)) {
                return encoding;
            }
        }
        throw new ScraperConfigException("Unknown encoding '" + raw + "', expected one of ascii, utf-8, smart");
    }
}
