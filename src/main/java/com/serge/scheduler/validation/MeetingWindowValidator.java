package com.serge.scheduler.validation;

import com.serge.scheduler.util.DateTimes;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.time.Instant;
import java.util.Optional;

public class MeetingWindowValidator implements ConstraintValidator<MeetingWindow, TimeWindow> {
    private boolean partial;

    @Override
    public void initialize(MeetingWindow annotation) {
        this.partial = annotation.partial();
    }

    @Override
    public boolean isValid(TimeWindow value, ConstraintValidatorContext context) {
        if (value == null) return true;
        Optional<Instant> start = DateTimes.parseInstant(value.getStartTime());
        Optional<Instant> end = DateTimes.parseInstant(value.getEndTime());
        // unparseable or missing ends are reported by the field constraints
        if (start.isEmpty() || end.isEmpty()) return true;

        Optional<String> problem = partial
                ? (start.get().isBefore(end.get()) ? Optional.empty() : Optional.of(Patterns.START_BEFORE_END))
                : MeetingRules.windowProblem(start.get(), end.get());
        if (problem.isEmpty()) return true;

        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(problem.get())
                .addPropertyNode("endTime")
                .addConstraintViolation();
        return false;
    }
}
