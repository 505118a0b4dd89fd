package com.tradestager.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wiring shared by the staging components.
 *
 * <p>The ledger backend is chosen with {@code tradestager.ledger.backend} ({@code memory}, the
 * default, or {@code redis}); the implementations carry their own conditions.
 */
@Configuration
public class StagingConfig {

    /** Single time source for audit timestamps and trade-date derivation. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
