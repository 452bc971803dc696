package com.reprise;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Main application class for Reprise - persistent response cache for language model calls.
 * Cache stores open their own SQLite connections per file, so no shared DataSource is configured.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class RepriseApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepriseApplication.class, args);
    }
}
