package com.rentnest.tm30.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * Feign client registration, kept off the application class so sliced tests skip it
 */
@Configuration
@EnableFeignClients(basePackages = "com.rentnest.tm30.client")
public class FeignClientsConfig {
}
