package com.williamcallahan.wikimark;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WikimarkApplication {

    public static void main(String[] args) {
        // Math images are drawn off-screen; no display is ever needed.
        System.setProperty("java.awt.headless", "true");
        SpringApplication.run(WikimarkApplication.class, args);
    }
}
