package com.autocoder.features.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
public class QueueConfig {

    /**
     * Source of randomness for regression sampling.
     * Tests construct the service with a seeded Random instead.
     */
    @Bean
    public Random regressionRandom() {
        return new Random();
    }
}
