package com.loopflow.loopflow_engine.io;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class RestTemplateHttpCaller implements HttpCaller {

    private final RestTemplate restTemplate;
    private final RestTemplateBuilder restTemplateBuilder;

    private static final long MAX_TIMEOUT_SECONDS = 600;

    // Steps with their own timeout (AI calls) get a template built for that timeout
    private final Map<Duration, RestTemplate> timedTemplates = new ConcurrentHashMap<>();

    public RestTemplateHttpCaller(RestTemplate restTemplate, RestTemplateBuilder restTemplateBuilder) {
        this.restTemplate = restTemplate;
        this.restTemplateBuilder = restTemplateBuilder;
    }

    @Override
    public HttpCallResponse exchange(HttpCallRequest request) {
        HttpHeaders headers = new HttpHeaders();
        request.headers().forEach(headers::set);
        if (request.body() != null && headers.getContentType() == null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }

        HttpEntity<String> entity = new HttpEntity<>(request.body(), headers);
        URI uri = toUri(request.url());
        log.debug("HTTP {} {}", request.method(), uri);

        try {
            ResponseEntity<String> response = templateFor(request.timeout())
                    .exchange(uri, HttpMethod.valueOf(request.method()), entity, String.class);
            return new HttpCallResponse(response.getStatusCode().value(), response.getBody(),
                    response.getHeaders().toSingleValueMap());

        } catch (RestClientResponseException ex) {
            HttpHeaders responseHeaders = ex.getResponseHeaders();
            return new HttpCallResponse(ex.getStatusCode().value(), ex.getResponseBodyAsString(),
                    responseHeaders != null ? responseHeaders.toSingleValueMap() : Map.of());
        }
    }

    RestTemplate templateFor(Duration timeout) {
        if (timeout == null) return restTemplate;
        return timedTemplates.computeIfAbsent(timeoutKey(timeout), t -> restTemplateBuilder
                .setConnectTimeout(t)
                .setReadTimeout(t)
                .build());
    }

    /** Whole seconds, rounded up and clamped, so the template cache stays bounded. */
    static Duration timeoutKey(Duration timeout) {
        long seconds = timeout.getSeconds() + (timeout.getNano() > 0 ? 1 : 0);
        return Duration.ofSeconds(Math.min(MAX_TIMEOUT_SECONDS, Math.max(1, seconds)));
    }

    /** Uses the URL verbatim when it is already a valid URI, otherwise encodes it. */
    static URI toUri(String url) {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException notEncoded) {
            return UriComponentsBuilder.fromUriString(url).encode().build().toUri();
        }
    }
}
