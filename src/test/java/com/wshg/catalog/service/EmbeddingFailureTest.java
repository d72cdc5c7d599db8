package com.wshg.catalog.service;

import com.wshg.catalog.dto.CreateResourceRequest;
import com.wshg.catalog.dto.UpdateResourceRequest;
import com.wshg.catalog.embedding.EmbeddingPort;
import com.wshg.catalog.error.EmbeddingException;
import com.wshg.catalog.error.OperationTimeoutException;
import com.wshg.catalog.error.VectorDimensionMismatchException;
import com.wshg.catalog.model.Deadline;
import com.wshg.catalog.repository.ChangeRecordRepository;
import com.wshg.catalog.repository.ResourceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Mutations whose embedding step fails or overruns must leave no resource row and no change record.
 */
@SpringBootTest
class EmbeddingFailureTest {

    @MockBean
    private EmbeddingPort embeddingPort;

    @Autowired
    private ResourceLifecycleService service;
    @Autowired
    private ResourceRepository resourceRepository;
    @Autowired
    private ChangeRecordRepository changeRecordRepository;

    @BeforeEach
    void cleanDatabase() {
        changeRecordRepository.deleteAll();
        resourceRepository.deleteAll();
    }

    private static CreateResourceRequest vm(String id) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("size", "t3.micro");
        return CreateResourceRequest.builder().id(id).type("vm").provider("aws").data(data).build();
    }

    private static float[] vector(int dims) {
        float[] v = new float[dims];
        v[0] = 1f;
        return v;
    }

    @Test
    void failedEmbeddingLeavesNothingBehind() {
        when(embeddingPort.generateVector(any(), any())).thenThrow(new EmbeddingException("model offline"));

        EmbeddingException ex = assertThrows(EmbeddingException.class, () -> service.createResource(vm("r1"), "alice"));
        assertTrue(ex.isRetryable());
        assertEquals(0, resourceRepository.count());
        assertEquals(0, changeRecordRepository.count());
    }

    @Test
    void unexpectedPortErrorIsReportedAsEmbeddingFailure() {
        when(embeddingPort.generateVector(any(), any())).thenThrow(new IllegalStateException("boom"));

        assertThrows(EmbeddingException.class, () -> service.createResource(vm("r1"), "alice"));
        assertEquals(0, resourceRepository.count());
    }

    @Test
    void wrongDimensionalityIsRejectedByTheStore() {
        when(embeddingPort.generateVector(any(), any())).thenReturn(vector(3));

        VectorDimensionMismatchException ex = assertThrows(VectorDimensionMismatchException.class,
                () -> service.createResource(vm("r1"), "alice"));
        assertEquals(64, ex.getExpected());
        assertEquals(3, ex.getActual());
        assertEquals(0, resourceRepository.count());
        assertEquals(0, changeRecordRepository.count());
    }

    @Test
    void failedReembeddingLeavesPreviousStateUntouched() {
        when(embeddingPort.generateVector(any(), any()))
                .thenReturn(vector(64))
                .thenThrow(new EmbeddingException("model offline"));
        service.createResource(vm("r1"), "alice");

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("size", "t3.large");
        assertThrows(EmbeddingException.class,
                () -> service.updateResource("r1", UpdateResourceRequest.builder().data(data).build(), "bob"));

        assertEquals("t3.micro", service.getResource("r1").getData().get("size"));
        assertEquals(1, changeRecordRepository.countByResourceId("r1"));
    }

    @Test
    void deadlinePassingDuringEmbeddingRollsBack() {
        when(embeddingPort.generateVector(any(), any())).thenAnswer(inv -> {
            Thread.sleep(200);
            return vector(64);
        });

        OperationTimeoutException ex = assertThrows(OperationTimeoutException.class,
                () -> service.createResource(vm("r1"), "alice", Deadline.after(Duration.ofMillis(50))));
        assertTrue(ex.isRetryable());
        assertEquals(0, resourceRepository.count());
        assertEquals(0, changeRecordRepository.count());
    }
}
