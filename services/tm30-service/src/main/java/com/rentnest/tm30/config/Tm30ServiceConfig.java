package com.rentnest.tm30.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(Tm30Properties.class)
public class Tm30ServiceConfig {

    /**
     * System UTC clock. Calendar logic applies {@code tm30.zone} itself
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
