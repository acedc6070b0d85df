package com.ehrgateway.dto;

import org.springframework.util.MultiValueMap;

import lombok.*;

/**
 * FHIR R4 search parameters accepted by the gateway, one class per resource.
 * Each class lists its fields explicitly with the FHIR wire name they map to.
 */
public class FhirSearchDTO {

    public static final String DEFAULT_COUNT = "10";

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PatientSearch {
        private String name;
        private String birthdate;
        private String identifier;
        private String id;
        private Integer count;
        private String sort;

        public MultiValueMap<String, String> toQueryParams() {
            return QueryParams.create()
                    .add("name", name)
                    .add("birthdate", birthdate)
                    .add("identifier", identifier)
                    .add("_id", id)
                    .add("_count", count)
                    .add("_sort", sort)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ObservationSearch {
        private String patient;
        private String category;
        private String code;
        private Integer count;
        private String sort;

        public MultiValueMap<String, String> toQueryParams() {
            return QueryParams.create()
                    .add("patient", patient)
                    .add("category", category)
                    .add("code", code)
                    .add("_count", count)
                    .add("_sort", sort)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EncounterSearch {
        private String patient;
        private String status;
        private String date;
        private Integer count;
        private String sort;

        public MultiValueMap<String, String> toQueryParams() {
            return QueryParams.create()
                    .add("patient", patient)
                    .add("status", status)
                    .add("date", date)
                    .add("_count", count)
                    .add("_sort", sort)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MedicationRequestSearch {
        private String patient;
        private String status;
        private Integer count;

        public MultiValueMap<String, String> toQueryParams() {
            return QueryParams.create()
                    .add("patient", patient)
                    .add("status", status)
                    .add("_count", count)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConditionSearch {
        private String patient;
        private String category;
        private Integer count;

        public MultiValueMap<String, String> toQueryParams() {
            return QueryParams.create()
                    .add("patient", patient)
                    .add("category", category)
                    .add("_count", count)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProcedureSearch {
        private String patient;
        private String date;
        private Integer count;

        public MultiValueMap<String, String> toQueryParams() {
            return QueryParams.create()
                    .add("patient", patient)
                    .add("date", date)
                    .add("_count", count)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AppointmentSearch {
        private String patient;
        private String date;
        private String status;
        private Integer count;

        public MultiValueMap<String, String> toQueryParams() {
            return QueryParams.create()
                    .add("patient", patient)
                    .add("date", date)
                    .add("status", status)
                    .add("_count", count)
                    .build();
        }
    }

    /**
     * Parameters of the $docref operation (Clinical Summary of Care document).
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DocRefParams {
        private String patient;
        private String start;
        private String end;

        public MultiValueMap<String, String> toQueryParams() {
            return QueryParams.create()
                    .add("patient", patient)
                    .add("start", start)
                    .add("end", end)
                    .build();
        }
    }
}
