package com.ytscraper.crawl.text;

import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cleans API text for export. Snippets come back HTML-escaped, so entities are always decoded first.
 */
@Component
public class TextNormalizer {
    private static final Pattern COMBINING_MARKS = Pattern.compile("[\\u0300-\\u036F]+");
    private static final Map<Character, String> SMART_REPLACEMENTS = Map.ofEntries(
        Map.entry('\u2018', "'"),
        Map.entry('\u2019', "'"),
        Map.entry('\u201A', "'"),
        Map.entry('\u2032', "'"),
        Map.entry('\u201C', "\""),
        Map.entry('\u201D', "\""),
        Map.entry('\u201E', "\""),
        Map.entry('\u2033', "\""),
        Map.entry('\u2010', "-"),
        Map.entry('\u2011', "-"),
        Map.entry('\u2012', "-"),
        Map.entry('\u2013', "-"),
        Map.entry('\u2014', "-"),
        Map.entry('\u2015', "-"),
        Map.entry('\u2026', "..."),
        Map.entry('\u00A0', " "),
        Map.entry('\u2022', "*"),
        Map.entry('\u00AB', "\""),
        Map.entry('\u00BB', "\"")
    );

    public String normalize(String text, TextEncoding encoding) {
        if (text == null) {
            return null;
        }
        String unescaped = Parser.unescapeEntities(text, false);
        return switch (encoding) {
            case ASCII -> asciiOnly(unescaped);
            case UTF_8 -> Normalizer.normalize(unescaped, Normalizer.Form.NFC);
            case SMART -> smart(unescaped);
        };
    }

    private String asciiOnly(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 0x80) {
                out.append(c);
            }
        }
        return out.toString();
    }

    // characters without an ASCII form are kept
    private String smart(String text) {
        StringBuilder replaced = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String replacement = SMART_REPLACEMENTS.get(c);
            replaced.append(replacement != null ? replacement : String.valueOf(c));
        }
        String decomposed = Normalizer.normalize(replaced, Normalizer.Form.NFKD);
        String folded = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return Normalizer.normalize(folded, Normalizer.Form.NFC);
    }
}
