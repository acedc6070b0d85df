package com.ehrgateway.controller;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.util.MultiValueMap;

import com.ehrgateway.dto.StandardApiDTO;
import com.ehrgateway.openemr.OpenEmrClient;
import com.ehrgateway.service.AuditService;
import com.ehrgateway.service.AuditService.AuditAction;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Controller tests for StandardApiController
 *
 * Uses standalone MockMvc with the gateway's exception handler.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("StandardApiController Tests")
class StandardApiControllerTest {

    private static final String AUTH = "Bearer test_token_123";

    private MockMvc mockMvc;
    private ObjectMapper objectMapper;

    @Mock
    private OpenEmrClient openEmrClient;

    @Mock
    private AuditService auditService;

    @InjectMocks
    private StandardApiController standardApiController;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        mockMvc = MockMvcBuilders.standaloneSetup(standardApiController)
                .setControllerAdvice(new ApiExceptionHandler(objectMapper))
                .build();
    }

    @Nested
    @DisplayName("POST /api/patient")
    class CreatePatientTests {

        @Test
        @DisplayName("Should create a patient and return 201")
        void shouldCreatePatient() throws Exception {
            when(openEmrClient.post(eq("/api/patient"), eq("test_token_123"), any()))
                    .thenReturn(objectMapper.readTree("{\"validationErrors\":[],\"data\":{\"pid\":\"42\"}}"));

            mockMvc.perform(post("/api/patient").header("Authorization", AUTH)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"fname\":\"John\",\"lname\":\"Doe\",\"dob\":\"1990-01-01\","
                                    + "\"postal_code\":\"12345\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.data.pid").value("42"));

            ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
            verify(openEmrClient).post(eq("/api/patient"), eq("test_token_123"), body.capture());
            StandardApiDTO.PatientCreateRequest sent = (StandardApiDTO.PatientCreateRequest) body.getValue();
            assertEquals("John", sent.getFname());
            assertEquals("Unknown", sent.getSex());
            assertEquals("12345", sent.getPostalCode());
            verify(auditService).log(AuditAction.CREATE_PHI, "patient", "42");
        }

        @Test
        @DisplayName("Should return 422 when lname is missing")
        void shouldRejectMissingLastName() throws Exception {
            mockMvc.perform(post("/api/patient").header("Authorization", AUTH)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"fname\":\"John\",\"dob\":\"1990-01-01\"}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.detail[0].loc[0]").value("body"))
                    .andExpect(jsonPath("$.detail[0].loc[1]").value("lname"));

            verifyNoInteractions(openEmrClient);
        }

        @Test
        @DisplayName("Should return 422 when dob is missing")
        void shouldRejectMissingDob() throws Exception {
            mockMvc.perform(post("/api/patient").header("Authorization", AUTH)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"fname\":\"John\",\"lname\":\"Doe\"}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.detail[0].loc[1]").value("dob"));

            verifyNoInteractions(openEmrClient);
        }

        @Test
        @DisplayName("Should return 422 for a malformed body")
        void shouldRejectMalformedBody() throws Exception {
            mockMvc.perform(post("/api/patient").header("Authorization", AUTH)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{not json"))
                    .andExpect(status().isUnprocessableEntity());

            verifyNoInteractions(openEmrClient);
        }
    }

    @Nested
    @DisplayName("GET routes")
    class ReadTests {

        @Test
        @DisplayName("Should return 401 with detail when no token is sent")
        void shouldRejectMissingToken() throws Exception {
            mockMvc.perform(get("/api/patient"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.detail", containsString("Authorization")));

            verifyNoInteractions(openEmrClient);
        }

        @Test
        @DisplayName("Should forward patient filters")
        @SuppressWarnings("unchecked")
        void shouldForwardPatientFilters() throws Exception {
            when(openEmrClient.get(eq("/api/patient"), eq("test_token_123"), any()))
                    .thenReturn(objectMapper.readTree("{\"data\":[]}"));

            mockMvc.perform(get("/api/patient").header("Authorization", AUTH).param("name", "Doe"))
                    .andExpect(status().isOk());

            ArgumentCaptor<MultiValueMap<String, String>> query = ArgumentCaptor.forClass(MultiValueMap.class);
            verify(openEmrClient).get(eq("/api/patient"), eq("test_token_123"), query.capture());
            assertEquals("Doe", query.getValue().getFirst("name"));
            assertEquals(1, query.getValue().size());
        }

        @Test
        @DisplayName("Should send pc_eid for appointment lookups")
        @SuppressWarnings("unchecked")
        void shouldForwardAppointmentFilters() throws Exception {
            when(openEmrClient.get(eq("/api/appointment"), eq("test_token_123"), any()))
                    .thenReturn(objectMapper.readTree("{\"data\":[]}"));

            mockMvc.perform(get("/api/appointment").header("Authorization", AUTH)
                            .param("pid", "1")
                            .param("pc_eid", "7"))
                    .andExpect(status().isOk());

            ArgumentCaptor<MultiValueMap<String, String>> query = ArgumentCaptor.forClass(MultiValueMap.class);
            verify(openEmrClient).get(eq("/api/appointment"), eq("test_token_123"), query.capture());
            assertEquals("1", query.getValue().getFirst("pid"));
            assertEquals("7", query.getValue().getFirst("pc_eid"));
        }

        @Test
        @DisplayName("Should read encounters of a patient")
        void shouldReadPatientEncounters() throws Exception {
            when(openEmrClient.get("/api/patient/1/encounter", "test_token_123"))
                    .thenReturn(objectMapper.readTree("{\"data\":[{\"eid\":\"5\"}]}"));

            mockMvc.perform(get("/api/patient/1/encounter").header("Authorization", AUTH))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data[0].eid").value("5"));

            verify(auditService).logPHIAccess("encounter", "1");
        }
    }
}
