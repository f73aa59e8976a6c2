package com.medicaledu.backend.global.jpa;

import com.medicaledu.backend.global.common.domain.Currency;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class CurrencyConverter implements AttributeConverter<Currency, String> {

    @Override
    public String convertToDatabaseColumn(Currency attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public Currency convertToEntityAttribute(String dbData) {
        return dbData == null || dbData.isBlank() ? null : Currency.of(dbData);
    }
}
