package com.hrflow.hrflow_backend.repository;

import com.hrflow.hrflow_backend.model.domain.WorkflowEdge;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WorkflowEdgeRepository extends JpaRepository<WorkflowEdge, Long> {
    List<WorkflowEdge> findByWorkflowIdOrderByIdAsc(Long workflowId);
}
