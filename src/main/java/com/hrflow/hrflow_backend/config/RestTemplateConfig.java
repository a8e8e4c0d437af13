package com.hrflow.hrflow_backend.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@RequiredArgsConstructor
public class RestTemplateConfig {

    private final HrflowProperties properties;

    // Shared by the n8n and CV parser clients; timeouts bound every outbound call
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(properties.getN8n().getConnectTimeout())
                .setReadTimeout(properties.getN8n().getReadTimeout())
                .build();
    }
}
