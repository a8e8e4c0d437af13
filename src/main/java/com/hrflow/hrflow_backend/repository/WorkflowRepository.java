package com.hrflow.hrflow_backend.repository;

import com.hrflow.hrflow_backend.model.domain.Workflow;
import org.springframework.data.jpa.repository.JpaRepository;

public interface WorkflowRepository extends JpaRepository<Workflow, Long> {}
