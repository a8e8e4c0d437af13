package com.hrflow.hrflow_backend.service;

import com.hrflow.hrflow_backend.model.domain.Execution;
import com.hrflow.hrflow_backend.model.domain.ExecutionStatus;
import com.hrflow.hrflow_backend.repository.ExecutionRepository;
import com.hrflow.hrflow_backend.repository.ExecutionStepRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutionQueryServiceTest {

    @Mock
    private ExecutionRepository executionRepository;

    @Mock
    private ExecutionStepRepository stepRepository;

    private ExecutionQueryService service;

    @BeforeEach
    void setUp() {
        service = new ExecutionQueryService(executionRepository, stepRepository);
    }

    @Test
    void list_picksFinderByFilters() {
        Execution execution = new Execution();
        when(executionRepository.findByWorkflowIdAndStatusOrderByStartedAtDesc(12L, ExecutionStatus.ENGINE_ERROR))
                .thenReturn(List.of(execution));
        when(executionRepository.findByStatusOrderByStartedAtDesc(ExecutionStatus.COMPLETED)).thenReturn(List.of());
        when(executionRepository.findByWorkflowIdOrderByStartedAtDesc(12L)).thenReturn(List.of());
        when(executionRepository.findAllByOrderByStartedAtDesc()).thenReturn(List.of());

        assertThat(service.list("engine_error", 12L)).containsExactly(execution);
        assertThat(service.list("completed", null)).isEmpty();
        assertThat(service.list(" ", 12L)).isEmpty();
        assertThat(service.list(null, null)).isEmpty();
    }

    @Test
    void list_unknownStatus_isRejected() {
        assertThatThrownBy(() -> service.list("done", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void delete_removesStepsThenExecution() {
        Execution execution = new Execution();
        execution.setId(100L);
        when(executionRepository.findById(100L)).thenReturn(Optional.of(execution));

        assertThat(service.delete(100L)).contains(execution);
        verify(stepRepository).deleteByExecutionId(100L);
        verify(executionRepository).delete(execution);
    }

    @Test
    void delete_missingExecution_touchesNothing() {
        when(executionRepository.findById(101L)).thenReturn(Optional.empty());

        assertThat(service.delete(101L)).isEmpty();
        verify(stepRepository, never()).deleteByExecutionId(anyLong());
        verify(executionRepository, never()).delete(any());
    }
}
