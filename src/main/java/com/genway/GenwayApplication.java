package com.genway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Genway - multi-provider LLM gateway with caching and rate limiting.
 */
@SpringBootApplication
public class GenwayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GenwayApplication.class, args);
    }
}
