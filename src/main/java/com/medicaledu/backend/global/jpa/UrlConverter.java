package com.medicaledu.backend.global.jpa;

import com.medicaledu.backend.global.common.domain.Url;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class UrlConverter implements AttributeConverter<Url, String> {

    @Override
    public String convertToDatabaseColumn(Url attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public Url convertToEntityAttribute(String dbData) {
        return dbData == null || dbData.isBlank() ? null : Url.of(dbData);
    }
}
