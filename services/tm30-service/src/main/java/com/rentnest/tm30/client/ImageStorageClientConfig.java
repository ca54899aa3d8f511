package com.rentnest.tm30.client;

import com.rentnest.tm30.config.Tm30Properties;
import feign.Request;
import feign.RequestInterceptor;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;

public class ImageStorageClientConfig {

    @Bean
    public Request.Options imageStorageRequestOptions(Tm30Properties properties) {
        Tm30Properties.Storage storage = properties.getStorage();
        return new Request.Options(
                storage.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS,
                storage.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS,
                true);
    }

    @Bean
    public RequestInterceptor imageStorageRequestInterceptor() {
        return template -> {
            template.header("Content-Type", "application/json");
            template.header("X-Service-Name", "tm30-service");
        };
    }
}
