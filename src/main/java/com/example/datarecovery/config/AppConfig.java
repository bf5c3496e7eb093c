package com.example.datarecovery.config;

import com.example.datarecovery.store.CollectionLocks;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class AppConfig {

    /**
     * Millisecond clock, matching the precision recovery point timestamps survive the database with.
     */
    @Bean
    public Clock clock() {
        return Clock.tick(Clock.systemUTC(), Duration.ofMillis(1));
    }

    @Bean
    public CollectionLocks collectionLocks(RecoveryConfig recoveryConfig) {
        return new CollectionLocks(recoveryConfig.getLockTimeout());
    }
}
