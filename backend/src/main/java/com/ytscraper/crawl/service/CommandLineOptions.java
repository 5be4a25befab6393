package com.ytscraper.crawl.service;

import com.ytscraper.crawl.options.ConfigOption;
import org.springframework.boot.ApplicationArguments;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command-line view over {@link ApplicationArguments}: positional words plus the flags this tool understands.
 * Spring's own property overrides ({@code --spring.*}, {@code --scraper.*}, {@code --logging.*}) pass through.
 */
final class CommandLineOptions {
    static final String VERBOSE = "verbose";
    static final String YES = "yes";
    private static final Set<String> FLAGS = Set.of(VERBOSE, YES);
    private static final List<String> PASS_THROUGH_PREFIXES = List.of("spring.", "scraper.", "logging.", "debug", "trace");

    private final ApplicationArguments args;

    CommandLineOptions(ApplicationArguments args) {
        this.args = args;
    }

    List<String> words() {
        return args.getNonOptionArgs();
    }

    boolean verbose() {
        return args.containsOption(VERBOSE);
    }

    boolean yes() {
        return args.containsOption(YES);
    }

    /**
     * Converted values for every option given on the command line. Repeated {@code --number} values form one
     * per-level schedule; for every other option the last occurrence wins.
     */
    Map<ConfigOption, Object> overrides() {
        Map<ConfigOption, Object> overrides = new EnumMap<>(ConfigOption.class);
        for (String name : args.getOptionNames()) {
            if (FLAGS.contains(name) || isPassThrough(name)) {
                continue;
            }
            ConfigOption option = optionFor(name);
            List<String> values = args.getOptionValues(name);
            if (values == null || values.isEmpty()) {
                throw new InvalidInputException("Option --" + name + " requires a value.");
            }
            String raw = option == ConfigOption.NUMBER
                ? String.join(",", values)
                : values.get(values.size() - 1);
            overrides.put(option, option.convert(raw));
        }
        return overrides;
    }

    private ConfigOption optionFor(String name) {
        for (ConfigOption option : ConfigOption.values()) {
            if (option.key().replace('_', '-').equals(name)) {
                return option;
            }
        }
        throw new InvalidInputException("Unknown option --" + name + ".");
    }

    private static boolean isPassThrough(String name) {
        for (String prefix : PASS_THROUGH_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
