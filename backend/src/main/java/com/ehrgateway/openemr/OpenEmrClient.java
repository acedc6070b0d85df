package com.ehrgateway.openemr;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyExtractors;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import com.ehrgateway.exception.UpstreamHttpException;
import com.ehrgateway.exception.UpstreamTransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import reactor.core.publisher.Mono;

/**
 * OpenEMR HTTP client
 *
 * Every gateway route ends up here. Two upstream bases are used:
 * - {base}/apis/default   FHIR R4 and Standard API resources
 * - {base}/oauth2/default authorization server (token, registration, authorize)
 *
 * Failures are normalized into two shapes:
 * - UpstreamHttpException: OpenEMR answered with a non-2xx status
 * - UpstreamTransportException: no usable answer (timeout, connection, bad body)
 *
 * Calls are blocking from the caller's point of view and never retried.
 */
public class OpenEmrClient {

    private static final Logger log = LoggerFactory.getLogger(OpenEmrClient.class);

    public static final String API_PATH = "/apis/default";
    public static final String OAUTH_PATH = "/oauth2/default";

    private static final MediaType FHIR_JSON = MediaType.parseMediaType("application/fhir+json");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration timeout;

    public OpenEmrClient(WebClient webClient, ObjectMapper objectMapper, String baseUrl, Duration timeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.timeout = timeout;
    }

    public String getApiBase() {
        return baseUrl + API_PATH;
    }

    public String getOAuthBase() {
        return baseUrl + OAUTH_PATH;
    }

    public JsonNode get(String path, String token) {
        return call(HttpMethod.GET, path, token, null, null);
    }

    public JsonNode get(String path, String token, MultiValueMap<String, String> queryParams) {
        return call(HttpMethod.GET, path, token, queryParams, null);
    }

    public JsonNode post(String path, String token, Object body) {
        return call(HttpMethod.POST, path, token, null, body);
    }

    /**
     * Call an FHIR / Standard API resource under {base}/apis/default.
     *
     * @param token bearer token to forward, or null for unauthenticated calls
     * @param queryParams already filtered query parameters, may be null
     * @param body request body serialized as JSON, may be null
     * @return the upstream JSON, or an empty object when the upstream sent no body
     */
    public JsonNode call(HttpMethod method, String path, String token,
                         MultiValueMap<String, String> queryParams, Object body) {
        URI uri = buildUri(getApiBase(), path, queryParams);

        WebClient.RequestBodySpec request = webClient.method(method)
                .uri(uri)
                .headers(headers -> {
                    if (token != null) {
                        headers.setBearerAuth(token);
                    }
                    headers.setAccept(List.of(FHIR_JSON));
                    headers.setContentType(MediaType.APPLICATION_JSON);
                });

        return execute(method, uri, body != null ? request.bodyValue(body) : request);
    }

    /**
     * POST a form-encoded body to an OAuth endpoint under {base}/oauth2/default.
     * Token endpoints only accept application/x-www-form-urlencoded.
     */
    public JsonNode postForm(String path, MultiValueMap<String, String> form) {
        URI uri = buildUri(getOAuthBase(), path, null);

        WebClient.RequestHeadersSpec<?> request = webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromFormData(form));

        return execute(HttpMethod.POST, uri, request);
    }

    /**
     * POST a JSON body to an OAuth endpoint under {base}/oauth2/default.
     */
    public JsonNode postJson(String path, Object body) {
        URI uri = buildUri(getOAuthBase(), path, null);

        WebClient.RequestHeadersSpec<?> request = webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body);

        return execute(HttpMethod.POST, uri, request);
    }

    private JsonNode execute(HttpMethod method, URI uri, WebClient.RequestHeadersSpec<?> request) {
        log.debug("OpenEMR {} {}", method, uri);

        return request
                .exchangeToMono(response -> readResponse(method, uri, response))
                .timeout(timeout)
                .onErrorMap(this::isTransportFailure, ex -> toTransportException(method, uri, ex))
                .block();
    }

    private Mono<JsonNode> readResponse(HttpMethod method, URI uri, ClientResponse response) {
        int status = response.statusCode().value();
        // joined without the codec's in-memory cap, bundles and CCDs can be large
        return DataBufferUtils.join(response.body(BodyExtractors.toDataBuffers()))
                .map(OpenEmrClient::readAndRelease)
                .defaultIfEmpty("")
                .map(content -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return parseSuccess(content);
                    }
                    log.warn("OpenEMR {} {} failed with HTTP {}", method, uri.getPath(), status);
                    throw new UpstreamHttpException(status, parseError(content, status, method, uri));
                });
    }

    private static String readAndRelease(DataBuffer buffer) {
        try {
            return buffer.toString(StandardCharsets.UTF_8);
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private JsonNode parseSuccess(String content) {
        if (content.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new UpstreamTransportException("Request error: malformed JSON response: "
                    + e.getOriginalMessage(), e);
        }
    }

    private JsonNode parseError(String content, int status, HttpMethod method, URI uri) {
        if (!content.isBlank()) {
            try {
                return objectMapper.readTree(content);
            } catch (JsonProcessingException e) {
                log.debug("OpenEMR error body is not JSON: {}", e.getOriginalMessage());
            }
        }
        ObjectNode synthetic = objectMapper.createObjectNode();
        synthetic.put("error", "HTTP " + status + " from OpenEMR for " + method + " " + uri);
        return synthetic;
    }

    private boolean isTransportFailure(Throwable ex) {
        return !(ex instanceof UpstreamHttpException) && !(ex instanceof UpstreamTransportException);
    }

    private UpstreamTransportException toTransportException(HttpMethod method, URI uri, Throwable ex) {
        String reason = ex instanceof TimeoutException
                ? "timed out after " + timeout.toMillis() + "ms"
                : ex.getMessage();
        log.warn("OpenEMR {} {} transport failure: {}", method, uri.getPath(), reason);
        return new UpstreamTransportException("Request error: " + reason, ex);
    }

    /**
     * Every query name and value is encoded strictly, so reserved characters
     * such as '+', '&' and '=' reach OpenEMR exactly as the caller sent them.
     */
    public static URI buildUri(String base, String path, MultiValueMap<String, String> queryParams) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(base)
                .path(UriUtils.encodePath(path, StandardCharsets.UTF_8));
        if (queryParams != null) {
            queryParams.forEach((name, values) -> values.forEach(value ->
                    builder.queryParam(UriUtils.encode(name, StandardCharsets.UTF_8),
                            UriUtils.encode(value, StandardCharsets.UTF_8))));
        }
        return builder.build(true).toUri();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
