package com.hrflow.hrflow_backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Reports at startup which engine settings are missing. Runs still start without them,
 * but end in engine_error (no API key) or failed (no credentials for email/database nodes).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngineStartupLogger implements ApplicationRunner {

    private final HrflowProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        HrflowProperties.N8n n8n = properties.getN8n();
        log.info("n8n API at {}, webhooks at {}", n8n.apiBaseUrl(), n8n.resolvedWebhookBaseUrl());

        if (!n8n.hasApiKey()) {
            log.warn("hrflow.n8n.api-key is not set: every execution will end in engine_error");
        }
        if (!properties.getCredentials().hasSmtp()) {
            log.warn("SMTP credential id/name not set: workflows with email nodes will fail to compile");
        }
        if (!properties.getCredentials().hasPostgres()) {
            log.warn("Postgres credential id/name not set: workflows with database nodes will fail to compile");
        }
        log.info("CV parser at {}, uploads in {}", properties.getCvParser().getUrl(), properties.getCvParser().getUploadDir());
    }
}
