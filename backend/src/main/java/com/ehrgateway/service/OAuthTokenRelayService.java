package com.ehrgateway.service;

import java.net.URI;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import com.ehrgateway.dto.OAuthDTO;
import com.ehrgateway.exception.OAuthRequestException;
import com.ehrgateway.exception.UpstreamTransportException;
import com.ehrgateway.openemr.OpenEmrClient;
import com.ehrgateway.store.StoredToken;
import com.ehrgateway.store.TokenStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * OAuth 2.0 relay to the OpenEMR authorization server
 *
 * - authorization redirect (response_type=code)
 * - callback: code exchange with the configured client
 * - token endpoint: authorization_code and refresh_token grants
 * - dynamic client registration
 *
 * Token endpoint bodies are always form-encoded. Client credentials are
 * only sent when configured.
 */
@Service
@Slf4j
public class OAuthTokenRelayService {

    public static final String DEFAULT_SCOPE = "openid api:fhir patient/Patient.rs user/Patient.rs";
    static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;
    private static final int STATE_BYTES = 32;

    private final OpenEmrClient openEmrClient;
    private final TokenStore tokenStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    @Value("${openemr.client-id:}")
    private String clientId;

    @Value("${openemr.client-secret:}")
    private String clientSecret;

    @Value("${openemr.redirect-uri:http://localhost:8000/oauth/callback}")
    private String redirectUri;

    public OAuthTokenRelayService(OpenEmrClient openEmrClient, TokenStore tokenStore,
                                  ObjectMapper objectMapper, Clock clock) {
        this.openEmrClient = openEmrClient;
        this.tokenStore = tokenStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Build the URL of the OpenEMR authorize page. A state value is generated
     * and remembered when the caller did not send one.
     */
    public URI buildAuthorizationRedirect(OAuthDTO.AuthorizeRequest request) {
        String client = hasText(request.getClientId()) ? request.getClientId() : clientId;
        if (!hasText(client)) {
            throw new OAuthRequestException("client_id is required");
        }

        String redirect = hasText(request.getRedirectUri()) ? request.getRedirectUri() : redirectUri;
        String scope = hasText(request.getScope()) ? request.getScope() : DEFAULT_SCOPE;
        String responseType = hasText(request.getResponseType()) ? request.getResponseType() : "code";

        String state = request.getState();
        if (!hasText(state)) {
            state = generateState();
            tokenStore.put(state, StoredToken.oauthState());
        }

        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("response_type", responseType);
        query.add("client_id", client);
        query.add("redirect_uri", redirect);
        query.add("scope", scope);
        query.add("state", state);
        return OpenEmrClient.buildUri(openEmrClient.getOAuthBase(), "/authorize", query);
    }

    /**
     * Exchange the code delivered to the callback for a token and remember it
     * until process exit.
     *
     * <p>The state is not checked against the values issued by
     * {@link #buildAuthorizationRedirect}: any code is exchanged whatever the
     * state. An unknown state is only logged.</p>
     */
    public JsonNode handleCallback(String code, String state) {
        if (state != null && !tokenStore.contains(state)) {
            log.warn("OAuth callback with a state the gateway did not issue; continuing with code exchange");
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", OAuthDTO.GRANT_AUTHORIZATION_CODE);
        form.add("code", code);
        form.add("redirect_uri", redirectUri);
        addClientCredentials(form);

        JsonNode tokenResponse = openEmrClient.postForm("/token", form);

        JsonNode accessToken = tokenResponse.get("access_token");
        if (accessToken != null && accessToken.isTextual()) {
            long expiresIn = tokenResponse.path("expires_in").asLong(DEFAULT_EXPIRES_IN_SECONDS);
            Instant expiresAt = clock.instant().plusSeconds(expiresIn);
            tokenStore.put(accessToken.asText(), StoredToken.issued(tokenResponse, expiresAt));
            log.info("Access token issued through callback, expires at {}", expiresAt);
        }

        return tokenResponse;
    }

    /**
     * Relay a token request to the OpenEMR token endpoint.
     */
    public OAuthDTO.TokenResponse exchange(OAuthDTO.TokenRequest request) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", request.getGrantType());

        if (OAuthDTO.GRANT_AUTHORIZATION_CODE.equals(request.getGrantType())) {
            if (!hasText(request.getCode())) {
                throw new OAuthRequestException("code is required for authorization_code grant");
            }
            form.add("code", request.getCode());
            form.add("redirect_uri", hasText(request.getRedirectUri()) ? request.getRedirectUri() : redirectUri);
            if (hasText(request.getCodeVerifier())) {
                form.add("code_verifier", request.getCodeVerifier());
            }
        } else if (OAuthDTO.GRANT_REFRESH_TOKEN.equals(request.getGrantType())) {
            if (!hasText(request.getRefreshToken())) {
                throw new OAuthRequestException("refresh_token is required for refresh_token grant");
            }
            form.add("refresh_token", request.getRefreshToken());
        }
        // other grant types go through as-is, OpenEMR rejects what it does not support

        addClientCredentials(form);

        log.info("Relaying {} grant to OpenEMR token endpoint", request.getGrantType());
        return toTokenResponse(openEmrClient.postForm("/token", form));
    }

    /**
     * Forward a dynamic client registration. The issued client_id and
     * client_secret are returned to the caller and not kept.
     */
    public JsonNode registerClient(OAuthDTO.ClientRegistration registration) {
        log.info("Registering OAuth client '{}'", registration.getClientName());
        return openEmrClient.postJson("/registration", registration);
    }

    private void addClientCredentials(MultiValueMap<String, String> form) {
        if (hasText(clientId)) {
            form.add("client_id", clientId);
        }
        if (hasText(clientSecret)) {
            form.add("client_secret", clientSecret);
        }
    }

    private OAuthDTO.TokenResponse toTokenResponse(JsonNode body) {
        OAuthDTO.TokenResponse token;
        try {
            token = objectMapper.treeToValue(body, OAuthDTO.TokenResponse.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new UpstreamTransportException("Request error: malformed token response: " + e.getMessage(), e);
        }
        if (token == null || !hasText(token.getAccessToken())) {
            throw new UpstreamTransportException("Request error: token response has no access_token");
        }
        if (!hasText(token.getTokenType())) {
            token.setTokenType("Bearer");
        }
        return token;
    }

    private String generateState() {
        byte[] bytes = new byte[STATE_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
