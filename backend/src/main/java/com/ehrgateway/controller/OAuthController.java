package com.ehrgateway.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import com.ehrgateway.dto.OAuthDTO;
import com.ehrgateway.service.OAuthTokenRelayService;
import com.fasterxml.jackson.databind.JsonNode;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * OAuth 2.0 endpoints relayed to the OpenEMR authorization server.
 * None of them require a bearer token.
 */
@RestController
@RequestMapping("/oauth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "OAuth 2.0 token management and client registration")
public class OAuthController {

    private final OAuthTokenRelayService tokenRelayService;

    @GetMapping("/authorize")
    @Operation(summary = "Start the authorization code flow (302 to OpenEMR)")
    public ResponseEntity<Void> authorize(
            @RequestParam(name = "response_type", defaultValue = "code") String responseType,
            @RequestParam(name = "client_id", required = false) String clientId,
            @RequestParam(name = "redirect_uri", required = false) String redirectUri,
            @RequestParam(required = false) String scope,
            @RequestParam(required = false) String state) {

        OAuthDTO.AuthorizeRequest request = OAuthDTO.AuthorizeRequest.builder()
            .responseType(responseType)
            .clientId(clientId)
            .redirectUri(redirectUri)
            .scope(scope)
            .state(state)
            .build();

        return ResponseEntity.status(HttpStatus.FOUND)
            .location(tokenRelayService.buildAuthorizationRedirect(request))
            .build();
    }

    @GetMapping("/callback")
    @Operation(summary = "Receive the authorization code and exchange it for a token")
    public ResponseEntity<JsonNode> callback(
            @RequestParam String code,
            @RequestParam(required = false) String state) {
        return ResponseEntity.ok(tokenRelayService.handleCallback(code, state));
    }

    @PostMapping("/token")
    @Operation(summary = "Get or refresh an access token")
    public ResponseEntity<OAuthDTO.TokenResponse> token(@Valid @RequestBody OAuthDTO.TokenRequest request) {
        return ResponseEntity.ok(tokenRelayService.exchange(request));
    }

    @PostMapping("/register")
    @Operation(summary = "Register an OAuth 2.0 client with OpenEMR")
    public ResponseEntity<JsonNode> register(@Valid @RequestBody OAuthDTO.ClientRegistration registration) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(tokenRelayService.registerClient(registration));
    }
}
