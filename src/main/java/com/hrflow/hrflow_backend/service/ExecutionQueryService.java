package com.hrflow.hrflow_backend.service;

import com.hrflow.hrflow_backend.model.domain.Execution;
import com.hrflow.hrflow_backend.model.domain.ExecutionStatus;
import com.hrflow.hrflow_backend.model.domain.ExecutionStep;
import com.hrflow.hrflow_backend.repository.ExecutionRepository;
import com.hrflow.hrflow_backend.repository.ExecutionStepRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionQueryService {

    private final ExecutionRepository executionRepository;
    private final ExecutionStepRepository stepRepository;

    // Newest first; both filters optional
    public List<Execution> list(String status, Long workflowId) {
        ExecutionStatus statusFilter = status != null && !status.isBlank() ? ExecutionStatus.fromValue(status) : null;

        if (statusFilter != null && workflowId != null) {
            return executionRepository.findByWorkflowIdAndStatusOrderByStartedAtDesc(workflowId, statusFilter);
        }
        if (statusFilter != null) {
            return executionRepository.findByStatusOrderByStartedAtDesc(statusFilter);
        }
        if (workflowId != null) {
            return executionRepository.findByWorkflowIdOrderByStartedAtDesc(workflowId);
        }
        return executionRepository.findAllByOrderByStartedAtDesc();
    }

    public Optional<Execution> get(Long id) {
        return executionRepository.findById(id);
    }

    public List<ExecutionStep> steps(Long executionId) {
        return stepRepository.findByExecutionIdOrderByIdAsc(executionId);
    }

    /** Administrative delete of an execution and its steps. */
    @Transactional
    public Optional<Execution> delete(Long id) {
        Optional<Execution> existing = executionRepository.findById(id);
        existing.ifPresent(execution -> {
            stepRepository.deleteByExecutionId(id);
            executionRepository.delete(execution);
            log.info("Deleted execution {} of workflow {}", id, execution.getWorkflowId());
        });
        return existing;
    }
}
