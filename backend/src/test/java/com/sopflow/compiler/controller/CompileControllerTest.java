package com.sopflow.compiler.controller;

import com.sopflow.compiler.dto.CompileRequest;
import com.sopflow.compiler.dto.CompileResponse;
import com.sopflow.compiler.service.WorkflowCompilerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CompileControllerTest {

    private WorkflowCompilerService compilerService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        compilerService = mock(WorkflowCompilerService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new CompileController(compilerService)).build();
    }

    @Test
    void compile_shouldReturnServiceResponse() throws Exception {
        when(compilerService.compile(any(CompileRequest.class)))
                .thenReturn(CompileResponse.invalidRequest("Source code exceeds maximum length"));

        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\":\"@task A\\n    @next END\\n\",\"sourceName\":\"a.sop\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.resultType").value("invalid_request"));
    }

    @Test
    void compile_shouldMapUnexpectedErrorsToInternalError() throws Exception {
        when(compilerService.compile(any(CompileRequest.class))).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\":\"@task A\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.resultType").value("internal_error"))
                .andExpect(jsonPath("$.error").value("Internal server error: boom"));
    }

    @Test
    void compile_shouldRejectBlankSourceBeforeCallingService() throws Exception {
        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.resultType").value("invalid_request"));

        verifyNoInteractions(compilerService);
    }

    @Test
    void health_shouldReportHealthy() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("SOP workflow compiler is healthy"));
    }
}
