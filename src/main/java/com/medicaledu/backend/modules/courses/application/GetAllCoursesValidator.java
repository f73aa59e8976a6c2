package com.medicaledu.backend.modules.courses.application;

import java.util.ArrayList;
import java.util.List;

import com.medicaledu.backend.global.pipeline.RequestValidator;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseSortField;

import org.springframework.stereotype.Component;

@Component
public class GetAllCoursesValidator implements RequestValidator<GetAllCoursesQuery> {

    @Override
    public List<String> validate(GetAllCoursesQuery query) {
        List<String> errors = new ArrayList<>();
        try {
            CourseSortField.fromParameter(query.sortBy());
        } catch (IllegalArgumentException ex) {
            errors.add("sortBy: must be one of title, price, createdAt, publishedAt, updatedAt, duration");
        }
        if (query.minPrice() != null && query.maxPrice() != null && query.minPrice().compareTo(query.maxPrice()) > 0) {
            errors.add("minPrice: must not exceed maxPrice");
        }
        if (query.createdFrom() != null && query.createdTo() != null && query.createdFrom().isAfter(query.createdTo())) {
            errors.add("createdFrom: must not be after createdTo");
        }
        if (query.publishedFrom() != null && query.publishedTo() != null
                && query.publishedFrom().isAfter(query.publishedTo())) {
            errors.add("publishedFrom: must not be after publishedTo");
        }
        if (query.minDuration() != null && query.maxDuration() != null && query.minDuration() > query.maxDuration()) {
            errors.add("minDuration: must not exceed maxDuration");
        }
        if (query.currency() != null && !query.currency().matches("(?i)^[a-z]{3}$")) {
            errors.add("currency: must be a three letter code");
        }
        return errors;
    }
}
