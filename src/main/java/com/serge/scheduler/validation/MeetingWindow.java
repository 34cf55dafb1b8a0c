package com.serge.scheduler.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

/**
 * Class-level check on a meeting input's {@code startTime}/{@code endTime} pair. With
 * {@code partial = true} the check only runs when both ends are supplied and only enforces ordering;
 * otherwise it also enforces {@link MeetingRules} duration bounds. Problems are reported on {@code endTime}.
 */
@Documented
@Constraint(validatedBy = MeetingWindowValidator.class)
@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface MeetingWindow {
    String message() default Patterns.START_BEFORE_END;

    boolean partial() default false;

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
