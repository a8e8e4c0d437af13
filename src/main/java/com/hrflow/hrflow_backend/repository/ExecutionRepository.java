package com.hrflow.hrflow_backend.repository;

import com.hrflow.hrflow_backend.model.domain.Execution;
import com.hrflow.hrflow_backend.model.domain.ExecutionStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ExecutionRepository extends JpaRepository<Execution, Long> {
    // All executions newest-first: used by the executions page
    List<Execution> findAllByOrderByStartedAtDesc();

    List<Execution> findByWorkflowIdOrderByStartedAtDesc(Long workflowId);

    List<Execution> findByStatusOrderByStartedAtDesc(ExecutionStatus status);

    List<Execution> findByWorkflowIdAndStatusOrderByStartedAtDesc(Long workflowId, ExecutionStatus status);
}
