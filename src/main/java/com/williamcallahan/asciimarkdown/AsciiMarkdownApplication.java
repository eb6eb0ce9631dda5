package com.williamcallahan.asciimarkdown;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AsciiMarkdownApplication {

    public static void main(String[] args) {
        SpringApplication.run(AsciiMarkdownApplication.class, args);
    }

}
