package com.rekindle.rex.core.engine;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class OrchestratorConfig {

    /** Time source for every component; tests substitute a controllable clock. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
