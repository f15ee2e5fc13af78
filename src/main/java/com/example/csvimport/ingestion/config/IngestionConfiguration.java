package com.example.csvimport.ingestion.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class IngestionConfiguration {

    @Bean
    public Clock ingestionClock() {
        return Clock.systemUTC();
    }
}
