package com.autocoder.features;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Feature backlog server.
 *
 * The coding agent talks to it one request at a time: fetch the next feature,
 * report the outcome, fetch again. All queue state lives in the database so a
 * crashed agent session resumes exactly where it stopped.
 */
@SpringBootApplication
public class FeatureServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeatureServerApplication.class, args);
    }
}
