package com.whaleradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WhaleRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(WhaleRadarApplication.class, args);
    }
}
