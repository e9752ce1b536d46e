package com.flagship.ebank_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Typed view of the {@code ebank.*} configuration tree.
 *
 * Defaults mirror the original deployment; every value can be overridden
 * through application.yml or the environment.
 */
@ConfigurationProperties(prefix = "ebank")
@Getter
@Setter
public class LedgerProperties {

    private Ledger ledger = new Ledger();
    private Accounts accounts = new Accounts();
    private Admin admin = new Admin();
    private Seed seed = new Seed();

    @Getter
    @Setter
    public static class Ledger {
        /**
         * Upper bound on waiting for an account row lock before the
         * operation fails with a retryable conflict.
         */
        private Duration lockTimeout = Duration.ofSeconds(3);

        /**
         * Zone used to turn calendar-day filters into instants.
         */
        private ZoneId zone = ZoneId.of("UTC");
    }

    @Getter
    @Setter
    public static class Accounts {
        private int numberGenerationAttempts = 10;
        private String defaultPin = "0000";
        private int pinHashStrength = 10;
    }

    @Getter
    @Setter
    public static class Admin {
        private String id = "admin";
        private String password = "a123";
    }

    @Getter
    @Setter
    public static class Seed {
        private boolean enabled = false;
    }
}
