package com.bastion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Bastion - resilient multi-provider gateway with cost-aware response caching.
 */
@SpringBootApplication
public class BastionApplication {

    public static void main(String[] args) {
        SpringApplication.run(BastionApplication.class, args);
    }
}
