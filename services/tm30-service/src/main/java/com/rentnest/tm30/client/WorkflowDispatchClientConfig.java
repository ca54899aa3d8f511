package com.rentnest.tm30.client;

import com.rentnest.tm30.config.Tm30Properties;
import feign.Request;
import feign.RequestInterceptor;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;

/**
 * Feign configuration for the workflow-dispatch client
 * Adds the executor bearer token to every call
 */
public class WorkflowDispatchClientConfig {

    @Bean
    public Request.Options workflowDispatchRequestOptions(Tm30Properties properties) {
        Tm30Properties.Executor executor = properties.getExecutor();
        return new Request.Options(
                executor.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS,
                executor.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS,
                true);
    }

    @Bean
    public RequestInterceptor workflowDispatchRequestInterceptor(Tm30Properties properties) {
        return template -> {
            template.header("Authorization", "Bearer " + properties.getExecutor().getToken());
            template.header("Accept", "application/vnd.github.v3+json");
            template.header("Content-Type", "application/json");
            template.header("X-Service-Name", "tm30-service");
        };
    }
}
