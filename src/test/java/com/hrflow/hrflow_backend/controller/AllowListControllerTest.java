package com.hrflow.hrflow_backend.controller;

import com.hrflow.hrflow_backend.exception.DuplicateDomainException;
import com.hrflow.hrflow_backend.model.domain.AllowedDomain;
import com.hrflow.hrflow_backend.service.AllowListService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AllowListControllerTest {

    @Mock
    private AllowListService allowListService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AllowListController(allowListService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void add_returnsCreatedRule() throws Exception {
        AllowedDomain saved = new AllowedDomain();
        saved.setId(5L);
        saved.setDomain("example.com");
        saved.setCreatedBy(7L);
        when(allowListService.add("Example.com", 7L)).thenReturn(saved);

        mockMvc.perform(post("/api/settings/allowed-domains")
                        .header("X-User-Id", "7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domain\":\"Example.com\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(5))
                .andExpect(jsonPath("$.domain").value("example.com"));
    }

    @Test
    void add_duplicate_isConflict() throws Exception {
        when(allowListService.add("example.com", null)).thenThrow(new DuplicateDomainException("example.com"));

        mockMvc.perform(post("/api/settings/allowed-domains")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domain\":\"example.com\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DOMAIN_EXISTS"));
    }

    @Test
    void add_blankDomain_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/settings/allowed-domains")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domain\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        verifyNoInteractions(allowListService);
    }

    @Test
    void remove_missingRule_isNotFound() throws Exception {
        when(allowListService.remove(9L, null)).thenReturn(false);

        mockMvc.perform(delete("/api/settings/allowed-domains/9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void remove_existingRule_isNoContent() throws Exception {
        when(allowListService.remove(5L, 7L)).thenReturn(true);

        mockMvc.perform(delete("/api/settings/allowed-domains/5").header("X-User-Id", "7"))
                .andExpect(status().isNoContent());
    }
}
