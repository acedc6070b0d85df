package com.ehrgateway.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@Tag(name = "Authentication")
public class RootController {

    @Value("${gateway.name:OpenEMR API Interface}")
    private String name;

    @Value("${gateway.version:1.0.0}")
    private String version;

    @Value("${openemr.base-url:https://localhost:9300}")
    private String openEmrUrl;

    @GetMapping("/")
    @Operation(summary = "API information")
    public ResponseEntity<Map<String, String>> info() {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("name", name);
        info.put("version", version);
        info.put("openemr_url", openEmrUrl);
        info.put("docs", "/docs");
        info.put("openapi", "/openapi.json");
        return ResponseEntity.ok(info);
    }
}
