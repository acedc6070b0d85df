package com.ehrgateway.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.*;

public class OAuthDTO {

    public static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
    public static final String GRANT_REFRESH_TOKEN = "refresh_token";

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TokenRequest {
        @NotBlank
        @JsonProperty("grant_type")
        @Schema(description = "Grant type: 'authorization_code' or 'refresh_token'", example = "authorization_code")
        private String grantType;

        @Schema(description = "Authorization code (required for authorization_code grant)")
        private String code;

        @JsonProperty("redirect_uri")
        @Schema(description = "Redirect URI (must match registered URI)")
        private String redirectUri;

        @JsonProperty("refresh_token")
        @Schema(description = "Refresh token (required for refresh_token grant)")
        private String refreshToken;

        @JsonProperty("code_verifier")
        @Schema(description = "PKCE code verifier (for public clients)")
        private String codeVerifier;
    }

    /**
     * Token record returned by the OpenEMR token endpoint.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TokenResponse {
        @JsonProperty("access_token")
        private String accessToken;

        @Builder.Default
        @JsonProperty("token_type")
        private String tokenType = "Bearer";

        @JsonProperty("expires_in")
        private Long expiresIn;

        @JsonProperty("refresh_token")
        private String refreshToken;

        private String scope;

        @JsonProperty("id_token")
        private String idToken;
    }

    /**
     * Dynamic client registration payload, forwarded verbatim to OpenEMR.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ClientRegistration {
        @NotBlank
        @JsonProperty("client_name")
        @Schema(example = "My Healthcare App")
        private String clientName;

        @NotEmpty
        @JsonProperty("redirect_uris")
        @Schema(example = "[\"http://localhost:8000/oauth/callback\"]")
        private List<String> redirectUris;

        @Schema(example = "openid api:fhir patient/Patient.rs user/Patient.rs")
        private String scope;

        @Builder.Default
        @JsonProperty("token_endpoint_auth_method")
        @Schema(allowableValues = {"client_secret_basic", "client_secret_post", "none"})
        private String tokenEndpointAuthMethod = "client_secret_basic";
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuthorizeRequest {
        @Builder.Default
        private String responseType = "code";
        private String clientId;
        private String redirectUri;
        private String scope;
        private String state;
    }
}
