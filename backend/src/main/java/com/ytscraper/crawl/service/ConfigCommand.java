package com.ytscraper.crawl.service;

import com.ytscraper.crawl.model.CrawlContext;
import com.ytscraper.crawl.options.ConfigOption;
import com.ytscraper.crawl.options.ScraperConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * {@code config get|set|unset|clear}: shows and modifies the persisted defaults.
 */
@Component
public class ConfigCommand {
    private static final Logger log = LoggerFactory.getLogger(ConfigCommand.class);

    private final ScraperConfigService configService;

    public ConfigCommand(ScraperConfigService configService) {
        this.configService = configService;
    }

    int execute(CommandLineOptions options, BufferedReader in, PrintStream out) {
        List<String> words = options.words();
        if (words.size() < 2) {
            throw new InvalidInputException("Missing config command, expected one of get, set, unset, clear.");
        }
        CrawlContext context = new CrawlContext(options.verbose());
        log.atLevel(context.verbose() ? Level.INFO : Level.DEBUG)
            .log("Using configuration file {}", configService.configPath());

        String action = words.get(1).toLowerCase(Locale.ROOT);
        switch (action) {
            case "get" -> get(argument(words, 2, "KEY"), out);
            case "set" -> {
                ConfigOption option = ConfigOption.fromKey(argument(words, 2, "KEY"));
                configService.set(option, argument(words, 3, "VALUE"), context);
                out.println("Successfully changed!");
            }
            case "unset" -> {
                configService.unset(ConfigOption.fromKey(argument(words, 2, "KEY")), context);
                out.println("Successfully written!");
            }
            case "clear" -> clear(options, context, in, out);
            default -> throw new InvalidInputException(
                "Unknown config command '" + words.get(1) + "', expected one of get, set, unset, clear."
            );
        }
        return 0;
    }

    private void get(String key, PrintStream out) {
        ConfigOption option = ConfigOption.fromKey(key);
        Optional<Object> value = configService.get(option);
        if (value.isPresent()) {
            out.println("The value of '" + option.key() + "' is set to " + value.get() + ".");
        } else {
            out.println("The value of '" + option.key() + "' is not set!");
        }
    }

    private void clear(CommandLineOptions options, CrawlContext context, BufferedReader in, PrintStream out) {
        boolean confirmed = options.yes();
        if (!confirmed) {
            out.print("Do you really want to clear the configuration file? [y/N]: ");
            out.flush();
            confirmed = readConfirmation(in);
        }
        if (confirmed) {
            configService.clear(context);
            out.println("Configuration file cleared!");
        } else {
            out.println("Aborted! Nothing changed.");
        }
    }

    private boolean readConfirmation(BufferedReader in) {
        try {
            String answer = in.readLine();
            if (answer == null) {
                return false;
            }
            String normalized = answer.trim().toLowerCase(Locale.ROOT);
            return normalized.equals("y") || normalized.equals("yes");
        } catch (IOException e) {
            throw new InvalidInputException("Could not read confirmation: " + e.getMessage());
        }
    }

    private static String argument(List<String> words, int index, String name) {
        if (words.size() <= index) {
            throw new InvalidInputException("Missing argument " + name + ".");
        }
        return words.get(index);
    }
}
