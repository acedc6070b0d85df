package com.ehrgateway.fhir;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import com.ehrgateway.dto.FhirSearchDTO;
import com.ehrgateway.openemr.OpenEmrClient;
import com.ehrgateway.security.BearerTokens;
import com.ehrgateway.service.AuditService;
import com.ehrgateway.service.AuditService.AuditAction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * FHIR R4 REST Controller
 *
 * Relays FHIR searches, reads and creates to OpenEMR's FHIR API:
 * - Patient (search, read, create)
 * - Observation, Encounter, MedicationRequest, Condition, Procedure, Appointment
 * - DocumentReference $docref (CCD generation)
 *
 * Everything but /fhir/metadata requires a bearer token. Resources are
 * passed through as raw JSON, OpenEMR does the FHIR validation.
 */
@RestController
@RequestMapping("/fhir")
@RequiredArgsConstructor
@Tag(name = "FHIR", description = "FHIR R4 API")
public class FhirProxyController {

    private final OpenEmrClient openEmrClient;
    private final AuditService auditService;

    /**
     * Capability statement, no authentication
     */
    @GetMapping("/metadata")
    @Operation(summary = "Get FHIR capability statement")
    public ResponseEntity<JsonNode> getCapabilityStatement() {
        return ResponseEntity.ok(openEmrClient.get("/fhir/metadata", null));
    }

    @GetMapping("/Patient")
    @Operation(summary = "Search patients")
    public ResponseEntity<JsonNode> searchPatients(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @RequestParam(required = false) String name,
            @RequestParam(required = false) String birthdate,
            @RequestParam(required = false) String identifier,
            @RequestParam(name = "_id", required = false) String id,
            @RequestParam(name = "_count", defaultValue = FhirSearchDTO.DEFAULT_COUNT) Integer count,
            @RequestParam(name = "_sort", required = false) String sort) {
        String token = BearerTokens.require(authorization);

        FhirSearchDTO.PatientSearch search = FhirSearchDTO.PatientSearch.builder()
                .name(name)
                .birthdate(birthdate)
                .identifier(identifier)
                .id(id)
                .count(count)
                .sort(sort)
                .build();

        auditService.log(AuditAction.SEARCH_PHI, "Patient", null);
        return ResponseEntity.ok(openEmrClient.get("/fhir/Patient", token, search.toQueryParams()));
    }

    @GetMapping("/Patient/{patientId}")
    @Operation(summary = "Get patient by ID")
    public ResponseEntity<JsonNode> getPatient(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @PathVariable String patientId) {
        String token = BearerTokens.require(authorization);

        auditService.logPHIAccess("Patient", patientId);
        return ResponseEntity.ok(openEmrClient.get("/fhir/Patient/" + patientId, token));
    }

    /**
     * Create a patient. The body is forwarded exactly as received.
     */
    @PostMapping("/Patient")
    @Operation(summary = "Create patient")
    public ResponseEntity<JsonNode> createPatient(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @RequestBody ObjectNode patient) {
        String token = BearerTokens.require(authorization);

        JsonNode created = openEmrClient.post("/fhir/Patient", token, patient);
        auditService.log(AuditAction.CREATE_PHI, "Patient", created.path("id").asText(null));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/Observation")
    @Operation(summary = "Search observations (vital signs, lab results)")
    public ResponseEntity<JsonNode> searchObservations(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @RequestParam(required = false) String patient,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String code,
            @RequestParam(name = "_count", defaultValue = FhirSearchDTO.DEFAULT_COUNT) Integer count,
            @RequestParam(name = "_sort", required = false) String sort) {
        String token = BearerTokens.require(authorization);

        FhirSearchDTO.ObservationSearch search = FhirSearchDTO.ObservationSearch.builder()
                .patient(patient)
                .category(category)
                .code(code)
                .count(count)
                .sort(sort)
                .build();

        return ResponseEntity.ok(openEmrClient.get("/fhir/Observation", token, search.toQueryParams()));
    }

    @GetMapping("/Encounter")
    @Operation(summary = "Search encounters")
    public ResponseEntity<JsonNode> searchEncounters(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @RequestParam(required = false) String patient,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String date,
            @RequestParam(name = "_count", defaultValue = FhirSearchDTO.DEFAULT_COUNT) Integer count,
            @RequestParam(name = "_sort", required = false) String sort) {
        String token = BearerTokens.require(authorization);

        FhirSearchDTO.EncounterSearch search = FhirSearchDTO.EncounterSearch.builder()
                .patient(patient)
                .status(status)
                .date(date)
                .count(count)
                .sort(sort)
                .build();

        return ResponseEntity.ok(openEmrClient.get("/fhir/Encounter", token, search.toQueryParams()));
    }

    @GetMapping("/MedicationRequest")
    @Operation(summary = "Search medication requests")
    public ResponseEntity<JsonNode> searchMedicationRequests(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @RequestParam(required = false) String patient,
            @RequestParam(required = false) String status,
            @RequestParam(name = "_count", defaultValue = FhirSearchDTO.DEFAULT_COUNT) Integer count) {
        String token = BearerTokens.require(authorization);

        FhirSearchDTO.MedicationRequestSearch search = FhirSearchDTO.MedicationRequestSearch.builder()
                .patient(patient)
                .status(status)
                .count(count)
                .build();

        return ResponseEntity.ok(openEmrClient.get("/fhir/MedicationRequest", token, search.toQueryParams()));
    }

    @GetMapping("/Condition")
    @Operation(summary = "Search conditions / problems")
    public ResponseEntity<JsonNode> searchConditions(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @RequestParam(required = false) String patient,
            @RequestParam(required = false) String category,
            @RequestParam(name = "_count", defaultValue = FhirSearchDTO.DEFAULT_COUNT) Integer count) {
        String token = BearerTokens.require(authorization);

        FhirSearchDTO.ConditionSearch search = FhirSearchDTO.ConditionSearch.builder()
                .patient(patient)
                .category(category)
                .count(count)
                .build();

        return ResponseEntity.ok(openEmrClient.get("/fhir/Condition", token, search.toQueryParams()));
    }

    @GetMapping("/Procedure")
    @Operation(summary = "Search procedures")
    public ResponseEntity<JsonNode> searchProcedures(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @RequestParam(required = false) String patient,
            @RequestParam(required = false) String date,
            @RequestParam(name = "_count", defaultValue = FhirSearchDTO.DEFAULT_COUNT) Integer count) {
        String token = BearerTokens.require(authorization);

        FhirSearchDTO.ProcedureSearch search = FhirSearchDTO.ProcedureSearch.builder()
                .patient(patient)
                .date(date)
                .count(count)
                .build();

        return ResponseEntity.ok(openEmrClient.get("/fhir/Procedure", token, search.toQueryParams()));
    }

    @GetMapping("/Appointment")
    @Operation(summary = "Search appointments")
    public ResponseEntity<JsonNode> searchAppointments(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @RequestParam(required = false) String patient,
            @RequestParam(required = false) String date,
            @RequestParam(required = false) String status,
            @RequestParam(name = "_count", defaultValue = FhirSearchDTO.DEFAULT_COUNT) Integer count) {
        String token = BearerTokens.require(authorization);

        FhirSearchDTO.AppointmentSearch search = FhirSearchDTO.AppointmentSearch.builder()
                .patient(patient)
                .date(date)
                .status(status)
                .count(count)
                .build();

        return ResponseEntity.ok(openEmrClient.get("/fhir/Appointment", token, search.toQueryParams()));
    }

    /**
     * Generate a Clinical Summary of Care document (CCD) for a patient
     */
    @GetMapping("/DocumentReference/$docref")
    @Operation(summary = "Generate clinical document ($docref)")
    public ResponseEntity<JsonNode> generateDocument(
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @RequestParam(required = false) String patient,
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end) {
        String token = BearerTokens.require(authorization);

        FhirSearchDTO.DocRefParams params = FhirSearchDTO.DocRefParams.builder()
                .patient(patient)
                .start(start)
                .end(end)
                .build();

        auditService.log(AuditAction.VIEW_PHI, "DocumentReference", patient);
        return ResponseEntity.ok(openEmrClient.get("/fhir/DocumentReference/$docref", token, params.toQueryParams()));
    }
}
