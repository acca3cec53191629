package com.gillianbc.wealthsim.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class SimulationConfig {

    @Bean(name = "simulationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService simulationExecutor(SimulationProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("wealthsim-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(properties.parallelism(), threadFactory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
