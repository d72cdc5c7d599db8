package com.wshg.catalog.controller;

import com.wshg.catalog.dto.CreateResourceRequest;
import com.wshg.catalog.error.ChainBrokenException;
import com.wshg.catalog.error.EmbeddingException;
import com.wshg.catalog.error.OperationTimeoutException;
import com.wshg.catalog.error.ResourceNotFoundException;
import com.wshg.catalog.error.ValidationException;
import com.wshg.catalog.model.Deadline;
import com.wshg.catalog.model.Resource;
import com.wshg.catalog.model.VectorState;
import com.wshg.catalog.service.ResourceLifecycleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {ResourceController.class, AuditController.class})
class ResourceControllerTest {

    private static final String VM_JSON = "{\"id\":\"r1\",\"type\":\"vm\",\"provider\":\"aws\",\"data\":{\"size\":\"t3.micro\"}}";

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ResourceLifecycleService lifecycleService;

    @Test
    void createReturns201WithoutVector() throws Exception {
        Resource created = Resource.builder().id("r1").type("vm").provider("aws")
                .vector(new float[]{0.6f, 0.8f}).vectorState(VectorState.ACTIVE).build();
        when(lifecycleService.createResource(any(CreateResourceRequest.class), eq("alice"), any(Deadline.class)))
                .thenReturn(created);

        mvc.perform(post("/api/resources").header("X-Actor", "alice")
                        .contentType(MediaType.APPLICATION_JSON).content(VM_JSON))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("r1"))
                .andExpect(jsonPath("$.vectorState").value("ACTIVE"))
                .andExpect(jsonPath("$.vector").doesNotExist());
    }

    @Test
    void validationFailureIs400WithField() throws Exception {
        when(lifecycleService.createResource(any(), any(), any())).thenThrow(ValidationException.missingField("type"));

        mvc.perform(post("/api/resources").contentType(MediaType.APPLICATION_JSON).content(VM_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.retryable").value(false))
                .andExpect(jsonPath("$.details.field").value("type"))
                .andExpect(jsonPath("$.details.reason").value("MISSING_FIELD"));
    }

    @Test
    void embeddingFailureIs502AndRetryable() throws Exception {
        when(lifecycleService.createResource(any(), any(), any())).thenThrow(new EmbeddingException("model offline"));

        mvc.perform(post("/api/resources").contentType(MediaType.APPLICATION_JSON).content(VM_JSON))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.kind").value("EMBEDDING_FAILED"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void timeoutIs504() throws Exception {
        when(lifecycleService.createResource(any(), any(), any()))
                .thenThrow(new OperationTimeoutException("create", Duration.ofMillis(5)));

        mvc.perform(post("/api/resources").header("X-Request-Timeout-Ms", "100")
                        .contentType(MediaType.APPLICATION_JSON).content(VM_JSON))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.kind").value("TIMEOUT"));
    }

    @Test
    void missingResourceIs404() throws Exception {
        when(lifecycleService.getResource("nope")).thenThrow(new ResourceNotFoundException("nope"));

        mvc.perform(get("/api/resources/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details.resourceId").value("nope"));
    }

    @Test
    void brokenChainIs409WithIndex() throws Exception {
        when(lifecycleService.verifyChain("r1"))
                .thenThrow(new ChainBrokenException("r1", 1, "c2", "aa", "bb"));

        mvc.perform(get("/api/audit/r1/verify"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("CHAIN_BROKEN"))
                .andExpect(jsonPath("$.details.index").value(1))
                .andExpect(jsonPath("$.details.recordId").value("c2"));
    }

    @Test
    void listParsesFiltersAndRejectsUnknownSort() throws Exception {
        mvc.perform(get("/api/resources").param("provider", "aws").param("tag", "env:prod").param("limit", "5"))
                .andExpect(status().isOk());
        verify(lifecycleService).listResources(argThat(q ->
                "aws".equals(q.getFilter().getProvider())
                        && "prod".equals(q.getFilter().getTags().get("env"))
                        && q.getLimit() == 5));

        mvc.perform(get("/api/resources").param("sort", "size"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field").value("sort"));
    }
}
