package com.serge.scheduler.validation;

import com.serge.scheduler.util.DateTimes;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class IsoDateTimeValidator implements ConstraintValidator<IsoDateTime, String> {
    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || DateTimes.parseInstant(value).isPresent();
    }
}
