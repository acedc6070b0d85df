package com.ehrgateway.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import com.ehrgateway.dto.StandardApiDTO;
import com.ehrgateway.openemr.OpenEmrClient;
import com.ehrgateway.security.BearerTokens;
import com.ehrgateway.service.AuditService;
import com.fasterxml.jackson.databind.JsonNode;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Standard API", description = "Native OpenEMR REST API")
public class StandardApiController {

    private final OpenEmrClient openEmrClient;
    private final AuditService auditService;

    @GetMapping("/patient")
    @Operation(summary = "List patients")
    public ResponseEntity<JsonNode> listPatients(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @RequestParam(required = false) String name,
            @RequestParam(required = false) String dob,
            @RequestParam(required = false) String pid) {
        String token = BearerTokens.require(authorization);

        StandardApiDTO.PatientFilter filter = StandardApiDTO.PatientFilter.builder()
            .name(name)
            .dob(dob)
            .pid(pid)
            .build();

        auditService.log(AuditService.AuditAction.SEARCH_PHI, "patient", pid);
        return ResponseEntity.ok(openEmrClient.get("/api/patient", token, filter.toQueryParams()));
    }

    @PostMapping("/patient")
    @Operation(summary = "Create patient")
    public ResponseEntity<JsonNode> createPatient(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @Valid @RequestBody StandardApiDTO.PatientCreateRequest request) {
        String token = BearerTokens.require(authorization);

        JsonNode created = openEmrClient.post("/api/patient", token, request);
        auditService.log(AuditService.AuditAction.CREATE_PHI, "patient", created.path("data").path("pid").asText(null));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/patient/{pid}")
    @Operation(summary = "Get patient by ID")
    public ResponseEntity<JsonNode> getPatient(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @PathVariable String pid) {
        String token = BearerTokens.require(authorization);

        auditService.logPHIAccess("patient", pid);
        return ResponseEntity.ok(openEmrClient.get("/api/patient/" + pid, token));
    }

    @GetMapping("/patient/{pid}/encounter")
    @Operation(summary = "Get patient encounters")
    public ResponseEntity<JsonNode> getPatientEncounters(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @PathVariable String pid) {
        String token = BearerTokens.require(authorization);

        auditService.logPHIAccess("encounter", pid);
        return ResponseEntity.ok(openEmrClient.get("/api/patient/" + pid + "/encounter", token));
    }

    @GetMapping("/encounter")
    @Operation(summary = "List encounters")
    public ResponseEntity<JsonNode> listEncounters(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @RequestParam(required = false) String pid,
            @RequestParam(required = false) String date) {
        String token = BearerTokens.require(authorization);

        StandardApiDTO.EncounterFilter filter = StandardApiDTO.EncounterFilter.builder()
            .pid(pid)
            .date(date)
            .build();

        return ResponseEntity.ok(openEmrClient.get("/api/encounter", token, filter.toQueryParams()));
    }

    @GetMapping("/appointment")
    @Operation(summary = "List appointments")
    public ResponseEntity<JsonNode> listAppointments(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @RequestParam(required = false) String pid,
            @RequestParam(name = "pc_eid", required = false) String pcEid,
            @RequestParam(required = false) String date) {
        String token = BearerTokens.require(authorization);

        StandardApiDTO.AppointmentFilter filter = StandardApiDTO.AppointmentFilter.builder()
            .pid(pid)
            .pcEid(pcEid)
            .date(date)
            .build();

        return ResponseEntity.ok(openEmrClient.get("/api/appointment", token, filter.toQueryParams()));
    }
}
