package com.ytscraper.crawl.options;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Value shapes an option may take. {@link #convert} is the only place where raw strings become option values.
 */
public enum OptionType {
    INTEGER {
        @Override
        Object convertText(String name, String raw, Set<String> choices) {
            return nonNegative(name, raw);
        }

        @Override
        boolean accepts(Object value, Set<String> choices) {
            return value instanceof Integer i && i >= 0;
        }
    },
    INTEGER_LIST {
        @Override
        Object convertText(String name, String raw, Set<String> choices) {
            List<Integer> values = new ArrayList<>();
            for (String part : raw.split(",")) {
                if (!part.isBlank()) {
                    values.add(nonNegative(name, part));
                }
            }
            if (values.isEmpty()) {
                throw new ScraperConfigException("Given value '" + raw + "' is not a valid integer for " + name + ".");
            }
            return values.size() == 1 ? values.get(0) : List.copyOf(values);
        }

        @Override
        boolean accepts(Object value, Set<String> choices) {
            if (value instanceof Integer i) {
                return i >= 0;
            }
            if (value instanceof Collection<?> values && !values.isEmpty()) {
                return values.stream().allMatch(v -> v instanceof Integer i && i >= 0);
            }
            return false;
        }
    },
    STRING {
        @Override
        Object convertText(String name, String raw, Set<String> choices) {
            return raw;
        }

        @Override
        boolean accepts(Object value, Set<String> choices) {
            return value instanceof String;
        }
    },
    CHOICE {
        @Override
        Object convertText(String name, String raw, Set<String> choices) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            if (!choices.contains(normalized)) {
                throw new ScraperConfigException(
                    "Given value '" + raw + "' is not valid for " + name + ". Please provide one of " + choices + "."
                );
            }
            return normalized;
        }

        @Override
        boolean accepts(Object value, Set<String> choices) {
            return value instanceof String s && choices.contains(s);
        }
    };

    public Object convert(String name, String raw, Set<String> choices) {
        if (raw == null) {
            throw new ScraperConfigException("Missing value for " + name + ".");
        }
        return convertText(name, raw.trim(), choices);
    }

    abstract Object convertText(String name, String raw, Set<String> choices);

    /**
     * Whether an already-typed value, e.g. one read back from the config file, fits this type.
     */
    abstract boolean accepts(Object value, Set<String> choices);

    private static int nonNegative(String name, String raw) {
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ScraperConfigException(
                "Given value '" + raw.trim() + "' is not a valid type for " + name + ". Please provide an integer."
            );
        }
        if (value < 0) {
            throw new ScraperConfigException(
                "Given integer " + value + " is negative! Please provide a non-negative value for " + name + "."
            );
        }
        return value;
    }
}
