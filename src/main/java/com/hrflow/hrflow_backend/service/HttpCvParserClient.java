package com.hrflow.hrflow_backend.service;

import com.hrflow.hrflow_backend.config.HrflowProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Calls the CV parser microservice with a multipart upload of the stored file.
 * Uploaded files are named "&lt;fileId&gt;.&lt;ext&gt;" inside the upload directory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpCvParserClient implements CvParserClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final HrflowProperties properties;

    @Override
    @SuppressWarnings("unchecked")
    public CvParseResult parse(String fileId) {
        String baseUrl = properties.getCvParser().getUrl();
        if (!isHealthy()) {
            log.warn("CV parser is not healthy at {}", baseUrl);
            return CvParseResult.failure(null,
                    "CV parser service unavailable at " + baseUrl + ". Make sure the service is running.");
        }

        Optional<Path> file = resolveUpload(fileId);
        if (file.isEmpty()) {
            return CvParseResult.failure(null, "File not found: " + fileId);
        }
        String filename = file.get().getFileName().toString();

        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("file", new FileSystemResource(file.get()));
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    baseUrl + "/parse", HttpMethod.POST, new HttpEntity<>(form, headers), JSON_OBJECT);
            Map<String, Object> body = response.getBody() != null ? response.getBody() : Map.of();
            Object data = body.get("data");
            log.info("Parsed CV {} ({})", fileId, filename);
            return CvParseResult.success(filename, data instanceof Map<?, ?> m ? (Map<String, Object>) m : body);
        } catch (RestClientException ex) {
            log.error("CV parser call failed for file {}: {}", fileId, ex.getMessage());
            return CvParseResult.failure(filename, ex.getMessage());
        }
    }

    boolean isHealthy() {
        try {
            return restTemplate.getForEntity(properties.getCvParser().getUrl() + "/health", String.class)
                    .getStatusCode().is2xxSuccessful();
        } catch (RestClientException ex) {
            log.debug("CV parser health check failed: {}", ex.getMessage());
            return false;
        }
    }

    Optional<Path> resolveUpload(String fileId) {
        if (fileId == null || fileId.isBlank() || fileId.contains("/") || fileId.contains("\\") || fileId.contains("..")) {
            return Optional.empty();
        }
        Path dir = Paths.get(properties.getCvParser().getUploadDir());
        if (!Files.isDirectory(dir)) {
            log.warn("Upload directory {} does not exist", dir.toAbsolutePath());
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> fileId.equals(stripExtension(p.getFileName().toString())))
                    .findFirst();
        } catch (IOException e) {
            log.error("Could not scan upload directory {}: {}", dir, e.getMessage());
            return Optional.empty();
        }
    }

    private static String stripExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
