package com.reprise;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Reprise - request-scoped response cache in front of WebFlux handlers.
 */
@SpringBootApplication
public class RepriseApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepriseApplication.class, args);
    }
}
