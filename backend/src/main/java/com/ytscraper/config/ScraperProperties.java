package com.ytscraper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT = "ytscraper/0.1";
    private static final String DEFAULT_CONFIG_FILE = "~/.ytscraper/config.json";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private String configFile = DEFAULT_CONFIG_FILE;
    private Api api = new Api();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public String getConfigFile() {
        return configFile;
    }

    public void setConfigFile(String configFile) {
        this.configFile = configFile == null || configFile.isBlank() ? DEFAULT_CONFIG_FILE : configFile.trim();
    }

    /**
     * Config file location with a leading {@code ~} expanded to the user's home directory.
     */
    public Path resolveConfigFile() {
        String value = getConfigFile();
        if (value.equals("~") || value.startsWith("~/")) {
            String home = System.getProperty("user.home");
            return Paths.get(home + value.substring(1)).toAbsolutePath().normalize();
        }
        return Paths.get(value).toAbsolutePath().normalize();
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Api {
        private static final String DEFAULT_BASE_URL = "https://www.googleapis.com/youtube/v3";

        private String baseUrl = DEFAULT_BASE_URL;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            if (baseUrl == null || baseUrl.isBlank()) {
                this.baseUrl = DEFAULT_BASE_URL;
                return;
            }
            String trimmed = baseUrl.trim();
            this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }
    }

    public static class Cli {
        private boolean exitAfterRun = true;

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
