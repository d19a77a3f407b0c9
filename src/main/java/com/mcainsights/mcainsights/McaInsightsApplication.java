package com.mcainsights.mcainsights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class McaInsightsApplication {

    public static void main(String[] args) {
        SpringApplication.run(McaInsightsApplication.class, args);
    }
}
