package com.csd.repograder.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AnalysisConfig {

    @Bean
    public Clock analysisClock() {
        return Clock.systemUTC();
    }
}
