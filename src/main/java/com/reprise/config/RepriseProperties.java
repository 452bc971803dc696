package com.reprise.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for Reprise.
 */
@Data
@Component
@ConfigurationProperties(prefix = "reprise")
public class RepriseProperties {

    private CacheConfig cache = new CacheConfig();
    private RemoteConfig remote = new RemoteConfig();

    @Data
    public static class CacheConfig {
        /**
         * Default store location; .db or .jsonl. A leading sqlite:/// is accepted.
         */
        private String path = System.getProperty("user.home") + "/.reprise/cache.db";

        /**
         * Used, with a warning, when {@link #path} is not writable. No fallback when unset.
         */
        private String fallbackPath;

        /**
         * Plain-dict JSON export ({key: entry}) imported into the store once, then renamed.
         */
        private String legacyJsonPath;

        private boolean immediateWrite = true;
    }

    @Data
    public static class RemoteConfig {
        private boolean enabled = false;
        private String keyPrefix = "reprise:entry:";
        private Duration ttl = Duration.ofDays(30);
    }
}
