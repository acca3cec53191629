package com.gillianbc.wealthsim.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "wealthsim")
public record SimulationProperties(
        Integer parallelism,
        Duration sessionIdleTimeout,
        Integer maxIterations,
        Long maxDrawTableSize
) {
    /** A draw table is one array, so it can never hold more than this many cells. */
    public static final long DRAW_TABLE_HARD_LIMIT = Integer.MAX_VALUE - 8;

    public SimulationProperties {
        if (parallelism == null || parallelism < 1) {
            parallelism = Runtime.getRuntime().availableProcessors();
        }
        if (sessionIdleTimeout == null) {
            sessionIdleTimeout = Duration.ofMinutes(30);
        }
        if (maxIterations == null || maxIterations < 1) {
            maxIterations = 20_000;
        }
        if (maxDrawTableSize == null || maxDrawTableSize < 1) {
            maxDrawTableSize = 50_000_000L;
        }
        maxDrawTableSize = Math.min(maxDrawTableSize, DRAW_TABLE_HARD_LIMIT);
    }
}
