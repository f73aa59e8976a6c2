package com.medicaledu.backend.global.jpa;

import com.medicaledu.backend.global.common.domain.PromoCodeValue;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class PromoCodeValueConverter implements AttributeConverter<PromoCodeValue, String> {

    @Override
    public String convertToDatabaseColumn(PromoCodeValue attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public PromoCodeValue convertToEntityAttribute(String dbData) {
        return dbData == null || dbData.isBlank() ? null : PromoCodeValue.of(dbData);
    }
}
