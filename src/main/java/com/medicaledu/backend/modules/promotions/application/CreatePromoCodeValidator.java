package com.medicaledu.backend.modules.promotions.application;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.medicaledu.backend.global.common.domain.PromoCodeValue;
import com.medicaledu.backend.global.pipeline.RequestValidator;
import com.medicaledu.backend.modules.promotions.domain.DiscountType;

import org.springframework.stereotype.Component;

@Component
public class CreatePromoCodeValidator implements RequestValidator<CreatePromoCodeCommand> {

    @Override
    public List<String> validate(CreatePromoCodeCommand command) {
        List<String> errors = new ArrayList<>();
        if (command.code() != null && !PromoCodeValue.isValid(command.code())) {
            errors.add("code: must be 4-20 letters or digits");
        }
        if (!command.validUntil().isAfter(command.validFrom())) {
            errors.add("validUntil: must be after validFrom");
        }
        if (command.discountType() == DiscountType.PERCENTAGE
                && command.discountValue().compareTo(BigDecimal.valueOf(100)) > 0) {
            errors.add("discountValue: percentage cannot exceed 100");
        }
        if (command.currency() != null && !command.currency().matches("(?i)^[a-z]{3}$")) {
            errors.add("currency: must be a three letter code");
        }
        return errors;
    }
}
