package com.compara;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Compara - side-by-side streaming comparison of AI models with credit metering.
 */
@SpringBootApplication
public class ComparaApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComparaApplication.class, args);
    }
}
