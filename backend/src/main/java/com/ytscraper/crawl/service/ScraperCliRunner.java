package com.ytscraper.crawl.service;

import com.ytscraper.config.ScraperProperties;
import com.ytscraper.crawl.ScraperException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

@Component
public class ScraperCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScraperCliRunner.class);
    static final String USAGE = String.join(System.lineSeparator(),
        "Usage:",
        "  search [term|url|id] <query> [--number=N ...] [--max-depth=D] [--api-key=KEY]",
        "         [--output-dir=DIR] [--output-format=csv] [--region-code=CODE] [--lang-code=CODE]",
        "         [--safe-search=none|moderate|strict] [--encoding=ascii|utf-8|smart] [--verbose]",
        "  config get KEY | config set KEY VALUE | config unset KEY | config clear [--yes]"
    );

    private final ScraperProperties properties;
    private final SearchCommand searchCommand;
    private final ConfigCommand configCommand;
    private final ConfigurableApplicationContext applicationContext;
    private final BufferedReader in;
    private final PrintStream out;

    @Autowired
    public ScraperCliRunner(
        ScraperProperties properties,
        SearchCommand searchCommand,
        ConfigCommand configCommand,
        ConfigurableApplicationContext applicationContext
    ) {
        this(
            properties,
            searchCommand,
            configCommand,
            applicationContext,
            new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
            System.out
        );
    }

    ScraperCliRunner(
        ScraperProperties properties,
        SearchCommand searchCommand,
        ConfigCommand configCommand,
        ConfigurableApplicationContext applicationContext,
        BufferedReader in,
        PrintStream out
    ) {
        this.properties = properties;
        this.searchCommand = searchCommand;
        this.configCommand = configCommand;
        this.applicationContext = applicationContext;
        this.in = in;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        int exitCode = execute(args);
        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    int execute(ApplicationArguments args) {
        CommandLineOptions options = new CommandLineOptions(args);
        List<String> words = options.words();
        if (words.isEmpty()) {
            out.println(USAGE);
            return 2;
        }
        try {
            String command = words.get(0).toLowerCase(Locale.ROOT);
            return switch (command) {
                case "search" -> searchCommand.execute(options, out);
                case "config" -> configCommand.execute(options, in, out);
                default -> throw new InvalidInputException("Unknown command '" + words.get(0) + "'.");
            };
        } catch (ScraperException e) {
            log.error(e.getMessage());
            log.debug("Command failed", e);
            if (e instanceof InvalidInputException) {
                out.println(USAGE);
            }
            return e.exitCode();
        }
    }
}
