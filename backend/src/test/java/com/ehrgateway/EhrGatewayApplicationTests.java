package com.ehrgateway;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import com.ehrgateway.openemr.OpenEmrClient;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Full context test: security filter chain, exception handler, OpenAPI
 * docs and routing wired together, with OpenEMR mocked out.
 */
@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = "openemr.base-url=https://emr.example.org")
@DisplayName("EHR Gateway Application Tests")
class EhrGatewayApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private OpenEmrClient openEmrClient;

    @Test
    @DisplayName("Should serve API information at the root")
    void shouldServeRootInfo() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("OpenEMR API Interface"))
                .andExpect(jsonPath("$.version").value("1.0.0"))
                .andExpect(jsonPath("$.openemr_url").value("https://emr.example.org"))
                .andExpect(jsonPath("$.docs").value("/docs"));
    }

    @Test
    @DisplayName("Should answer CORS preflight for any origin")
    void shouldAnswerCorsPreflight() throws Exception {
        mockMvc.perform(options("/fhir/Patient")
                        .header("Origin", "https://app.example.com")
                        .header("Access-Control-Request-Method", "GET")
                        .header("Access-Control-Request-Headers", "Authorization"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "https://app.example.com"))
                .andExpect(header().string("Access-Control-Allow-Credentials", "true"));
    }

    @Test
    @DisplayName("Should reach protected routes without gateway authentication and reject missing bearer")
    void shouldRejectMissingBearerThroughFilterChain() throws Exception {
        mockMvc.perform(get("/fhir/Patient"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Authorization header with Bearer token required"));

        verifyNoInteractions(openEmrClient);
    }

    @Test
    @DisplayName("Should relay a FHIR search through the full stack")
    void shouldRelayFhirSearch() throws Exception {
        when(openEmrClient.get(eq("/fhir/Patient"), eq("abc"), any()))
                .thenReturn(objectMapper.readTree("{\"resourceType\":\"Bundle\",\"total\":0}"));

        mockMvc.perform(get("/fhir/Patient").header("Authorization", "Bearer abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resourceType").value("Bundle"));
    }

    @Test
    @DisplayName("Should publish the OpenAPI document")
    void shouldPublishOpenApi() throws Exception {
        mockMvc.perform(get("/openapi.json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paths['/fhir/Patient']").exists())
                .andExpect(jsonPath("$.paths['/oauth/token']").exists());
    }
}
