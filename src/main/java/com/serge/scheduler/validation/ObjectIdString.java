package com.serge.scheduler.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

/**
 * The string is a syntactically valid document id. Existence is not checked. {@code null} is valid.
 */
@Documented
@Constraint(validatedBy = ObjectIdStringValidator.class)
@Target({ElementType.FIELD, ElementType.TYPE_USE})
@Retention(RetentionPolicy.RUNTIME)
public @interface ObjectIdString {
    String message() default "Invalid id";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
