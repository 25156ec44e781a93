package com.rightsparser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Rights Parser Application
 *
 * Accepts rights licensing agreements, extracts structured deal terms
 * through a language model and publishes the result to content-addressed storage.
 */
@SpringBootApplication
public class RightsParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(RightsParserApplication.class, args);
    }

}
