package com.hrflow.hrflow_backend.model.domain.converter;

import com.hrflow.hrflow_backend.model.domain.StepStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class StepStatusConverter implements AttributeConverter<StepStatus, String> {

    @Override
    public String convertToDatabaseColumn(StepStatus attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public StepStatus convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        return StepStatus.fromValue(dbData.trim());
    }
}
