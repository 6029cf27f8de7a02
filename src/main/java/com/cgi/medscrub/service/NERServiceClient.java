package com.cgi.medscrub.service;

import com.cgi.medscrub.api.NamedEntityRecognizer;
import com.cgi.medscrub.config.ScrubberProperties;
import com.cgi.medscrub.exception.StatisticalModelException;
import com.cgi.medscrub.model.RecognizedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Client for an external NER (Named Entity Recognition) service.
 * Uses RestTemplate to post one text per request and read back labeled spans.
 */
public class NERServiceClient implements NamedEntityRecognizer {
    private static final Logger log = LoggerFactory.getLogger(NERServiceClient.class);

    private final String nerServiceUrl;
    private final String healthUrl;
    private final String modelName;
    private final RestTemplate restTemplate;

    /**
     * Constructor
     *
     * @param properties NER service settings
     */
    public NERServiceClient(ScrubberProperties.Ner properties) {
        this(properties.getServiceUrl(), properties.getHealthPath(), properties.getModelName(),
                createRestTemplate(properties.getConnectTimeoutMs(), properties.getReadTimeoutMs()));
    }

    /**
     * Constructor
     *
     * @param nerServiceUrl NER endpoint URL
     * @param healthPath Path of the health endpoint on the same host
     * @param modelName Name reported in warnings
     * @param restTemplate Template used for the calls
     */
    public NERServiceClient(String nerServiceUrl, String healthPath, String modelName, RestTemplate restTemplate) {
        if (nerServiceUrl == null || nerServiceUrl.isBlank()) {
            throw new IllegalArgumentException("NER service URL is required");
        }
        this.nerServiceUrl = nerServiceUrl;
        this.healthUrl = UriComponentsBuilder.fromHttpUrl(nerServiceUrl).replacePath(healthPath).replaceQuery(null)
                .toUriString();
        this.modelName = modelName;
        this.restTemplate = restTemplate;

        log.info("NER Service Client initialized with URL: {}", nerServiceUrl);
    }

    @Override
    public String getModelName() {
        return modelName;
    }

    /**
     * Sends a text to the NER service.
     * The service answers {@code {"entities": [{label, text, start, end, score}, ...]}}.
     *
     * @param text Text to analyze
     * @return Entities found in the text
     * @throws StatisticalModelException if the call fails or the answer is not usable
     */
    @Override
    public List<RecognizedEntity> infer(String text) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(Map.of("text", text), headers);

        log.debug("Sending {} characters to NER service", text.length());

        ResponseEntity<Map<String, List<RecognizedEntity>>> response;
        try {
            response = restTemplate.exchange(
                    nerServiceUrl,
                    HttpMethod.POST,
                    request,
                    new ParameterizedTypeReference<Map<String, List<RecognizedEntity>>>() {});
        } catch (RestClientException e) {
            throw new StatisticalModelException("NER service call failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new StatisticalModelException("NER service returned " + response.getStatusCode());
        }
        List<RecognizedEntity> entities = response.getBody().get("entities");
        if (entities == null) {
            log.warn("NER service response has no entities field");
            return Collections.emptyList();
        }
        return entities;
    }

    /**
     * Checks if the NER service is available.
     *
     * @return true if the service is available
     */
    @Override
    public boolean isAvailable() {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(healthUrl, String.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            log.warn("NER service not available: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Creates a RestTemplate with the configured timeouts.
     */
    private static RestTemplate createRestTemplate(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(requestFactory);
    }
}
