package com.hrflow.hrflow_backend.model.domain.converter;

import com.hrflow.hrflow_backend.model.domain.ExecutionStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ExecutionStatusConverter implements AttributeConverter<ExecutionStatus, String> {

    @Override
    public String convertToDatabaseColumn(ExecutionStatus attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public ExecutionStatus convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        return ExecutionStatus.fromValue(dbData.trim());
    }
}
