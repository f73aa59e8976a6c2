package com.medicaledu.backend.modules.availability.application;

import java.util.List;

import com.medicaledu.backend.global.pipeline.RequestValidator;

import org.springframework.stereotype.Component;

@Component
public class GetAvailabilitySlotsValidator implements RequestValidator<GetAvailabilitySlotsQuery> {

    @Override
    public List<String> validate(GetAvailabilitySlotsQuery query) {
        if (query.startDate() != null && query.endDate() != null && query.startDate().isAfter(query.endDate())) {
            return List.of("startDate: must not be after endDate");
        }
        return List.of();
    }
}
