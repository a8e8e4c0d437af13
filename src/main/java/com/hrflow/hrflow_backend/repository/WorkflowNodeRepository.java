package com.hrflow.hrflow_backend.repository;

import com.hrflow.hrflow_backend.model.domain.WorkflowNode;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WorkflowNodeRepository extends JpaRepository<WorkflowNode, Long> {
    // Id order is the graph's input order for the orderer and the step list
    List<WorkflowNode> findByWorkflowIdOrderByIdAsc(Long workflowId);
}
