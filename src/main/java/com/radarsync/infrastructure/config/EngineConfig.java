package com.radarsync.infrastructure.config;

import com.radarsync.core.fingerprint.FingerprintDiffer;
import com.radarsync.core.fingerprint.FingerprintEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Registers the framework-free core components as beans.
 */
@Configuration
public class EngineConfig {

    @Bean
    public FingerprintEngine fingerprintEngine() {
        return new FingerprintEngine();
    }

    @Bean
    public FingerprintDiffer fingerprintDiffer() {
        return new FingerprintDiffer();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
