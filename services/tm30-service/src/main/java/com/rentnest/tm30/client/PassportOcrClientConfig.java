package com.rentnest.tm30.client;

import com.rentnest.tm30.config.Tm30Properties;
import feign.Request;
import feign.RequestInterceptor;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;

/**
 * Feign configuration for the OCR client. Scoped to that client only
 */
public class PassportOcrClientConfig {

    @Bean
    public Request.Options passportOcrRequestOptions(Tm30Properties properties) {
        Tm30Properties.Ocr ocr = properties.getOcr();
        return new Request.Options(
                ocr.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS,
                ocr.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS,
                true);
    }

    @Bean
    public RequestInterceptor passportOcrRequestInterceptor() {
        return template -> {
            template.header("Content-Type", "application/json");
            template.header("X-Service-Name", "tm30-service");
        };
    }
}
