package com.williamcallahan.book_graph.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * UTC clock for defaulted creation dates; tests substitute a fixed one.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
