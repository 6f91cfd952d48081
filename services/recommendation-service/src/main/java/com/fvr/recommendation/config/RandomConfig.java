package com.fvr.recommendation.config;

import java.time.Clock;
import java.util.Random;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RandomConfig {

    @Bean
    public Random recommendationRandom() {
        return new Random();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
