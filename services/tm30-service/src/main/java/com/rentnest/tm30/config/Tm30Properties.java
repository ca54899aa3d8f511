package com.rentnest.tm30.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

/**
 * TM30 pipeline settings bound from the {@code tm30} prefix
 */
@Data
@Validated
@ConfigurationProperties(prefix = "tm30")
public class Tm30Properties {

    /**
     * Zone used for every calendar comparison and wire date
     */
    @NotNull
    private ZoneId zone = ZoneId.of("Asia/Bangkok");

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Security security = new Security();

    @Valid
    private Executor executor = new Executor();

    @Valid
    private Storage storage = new Storage();

    @Valid
    private Ocr ocr = new Ocr();

    @Data
    public static class Scheduler {
        private boolean enabled = true;

        @NotBlank
        private String cron = "0 0 6 * * *";
    }

    @Data
    public static class Security {
        /**
         * Shared key accepted from internal callers in the {@code X-API-Key} header
         */
        private String internalApiKey;

        /**
         * Bearer secret for the cron endpoint. Unset means every call is rejected
         */
        private String cronSecret;

        /**
         * Secret the automation executor sends with status callbacks
         */
        private String callbackSecret;
    }

    @Data
    public static class Executor {
        /**
         * Bearer token for the workflow-dispatch API. Unset selects manual hand-off
         */
        private String token;

        /**
         * Repository in {@code owner/name} form that receives the dispatch
         */
        private String repository;

        @NotBlank
        private String eventType = "tm30-action";

        @NotBlank
        private String url = "https://api.github.com";

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Storage {
        @NotBlank
        private String url = "http://localhost:8095";

        @NotBlank
        private String folderPrefix = "/passports";

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Ocr {
        @NotBlank
        private String url = "http://localhost:8096";

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(45);
    }
}
