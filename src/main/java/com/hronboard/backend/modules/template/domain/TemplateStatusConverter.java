package com.hronboard.backend.modules.template.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class TemplateStatusConverter implements AttributeConverter<TemplateStatus, String> {

    @Override
    public String convertToDatabaseColumn(TemplateStatus attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public TemplateStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : TemplateStatus.fromCode(dbData);
    }
}
