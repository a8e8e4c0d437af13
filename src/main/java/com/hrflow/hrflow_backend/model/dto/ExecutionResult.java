package com.hrflow.hrflow_backend.model.dto;

import com.hrflow.hrflow_backend.model.domain.Execution;
import com.hrflow.hrflow_backend.model.domain.ExecutionStep;

import java.util.List;

/** Everything one run produced: the terminal record, its steps and the raw engine reply (null when the engine was not reached). */
public record ExecutionResult(Execution execution, List<ExecutionStep> steps, Object engineResult) {}
