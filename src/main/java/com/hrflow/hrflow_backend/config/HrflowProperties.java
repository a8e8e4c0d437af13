package com.hrflow.hrflow_backend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "hrflow")
@Getter
@Setter
public class HrflowProperties {

    private N8n n8n = new N8n();
    private Credentials credentials = new Credentials();
    private Email email = new Email();
    private CvParser cvParser = new CvParser();

    @Getter
    @Setter
    public static class N8n {
        private String baseUrl = "http://localhost:5678";
        private String apiKey = "";
        // Public base for webhook calls when n8n sits behind a tunnel; falls back to baseUrl
        private String webhookBaseUrl = "";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(60);

        public String apiBaseUrl() {
            return stripTrailingSlash(baseUrl) + "/api/v1";
        }

        public String resolvedWebhookBaseUrl() {
            String base = webhookBaseUrl == null || webhookBaseUrl.isBlank() ? baseUrl : webhookBaseUrl;
            return stripTrailingSlash(base);
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    /** Ids and names of credentials created inside n8n ahead of time. */
    @Getter
    @Setter
    public static class Credentials {
        private String postgresId = "";
        private String postgresName = "";
        private String smtpId = "";
        private String smtpName = "";

        public boolean hasPostgres() {
            return notBlank(postgresId) && notBlank(postgresName);
        }

        public boolean hasSmtp() {
            return notBlank(smtpId) && notBlank(smtpName);
        }
    }

    @Getter
    @Setter
    public static class Email {
        private String defaultSender = "noreply@hrflow.local";
        private String defaultRecipient = "demo@example.com";
    }

    @Getter
    @Setter
    public static class CvParser {
        private String url = "http://localhost:8000";
        private String uploadDir = "uploads";
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) return "";
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
