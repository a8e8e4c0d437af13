package com.hrflow.hrflow_backend.repository;

import com.hrflow.hrflow_backend.model.domain.ExecutionStep;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ExecutionStepRepository extends JpaRepository<ExecutionStep, Long> {
    List<ExecutionStep> findByExecutionIdOrderByIdAsc(Long executionId);

    void deleteByExecutionId(Long executionId);
}
