package com.ytscraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class YtScraperApplication {

    public static void main(String[] args) {
        SpringApplication.run(YtScraperApplication.class, args);
    }
}
