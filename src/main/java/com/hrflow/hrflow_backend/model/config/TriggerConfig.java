package com.hrflow.hrflow_backend.model.config;

import com.hrflow.hrflow_backend.model.domain.NodeKind;

/** Static employee values typed into the trigger node. Blank fields are read from the webhook body instead. */
public record TriggerConfig(
        String name,
        String email,
        String department,
        String role,
        String startDate,
        String managerEmail
) implements NodeConfig {

    @Override
    public NodeKind kind() { return NodeKind.TRIGGER; }
}
