package com.hronboard.backend.modules.approval.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ApprovalStatusConverter implements AttributeConverter<ApprovalStatus, String> {

    @Override
    public String convertToDatabaseColumn(ApprovalStatus attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public ApprovalStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : ApprovalStatus.fromCode(dbData);
    }
}
