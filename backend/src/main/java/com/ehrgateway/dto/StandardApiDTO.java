package com.ehrgateway.dto;

import org.springframework.util.MultiValueMap;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * Payloads and filters of the native OpenEMR REST API (/api/...).
 */
public class StandardApiDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PatientCreateRequest {
        @NotBlank
        @Schema(example = "John")
        private String fname;

        @NotBlank
        @Schema(example = "Doe")
        private String lname;

        @NotBlank
        @Schema(description = "Date of birth (YYYY-MM-DD)", example = "1990-01-01")
        private String dob;

        @Builder.Default
        @Schema(allowableValues = {"Male", "Female", "Other", "Unknown"})
        private String sex = "Unknown";

        private String street;
        private String city;
        private String state;

        @JsonProperty("postal_code")
        private String postalCode;

        @JsonProperty("phone_cell")
        private String phoneCell;

        private String email;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PatientFilter {
        private String name;
        private String dob;
        private String pid;

        public MultiValueMap<String, String> toQueryParams() {
            return QueryParams.create()
                    .add("name", name)
                    .add("dob", dob)
                    .add("pid", pid)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EncounterFilter {
        private String pid;
        private String date;

        public MultiValueMap<String, String> toQueryParams() {
            return QueryParams.create()
                    .add("pid", pid)
                    .add("date", date)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AppointmentFilter {
        private String pid;
        private String pcEid;
        private String date;

        public MultiValueMap<String, String> toQueryParams() {
            return QueryParams.create()
                    .add("pid", pid)
                    .add("pc_eid", pcEid)
                    .add("date", date)
                    .build();
        }
    }
}
