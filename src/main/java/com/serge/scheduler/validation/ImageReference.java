package com.serge.scheduler.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

/**
 * An image reference: an http(s) URL, an empty string, or a JSON object string with
 * {@code thumb}, {@code small} and {@code medium} entries.
 */
@Documented
@Constraint(validatedBy = ImageReferenceValidator.class)
@Target({ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
public @interface ImageReference {
    String message() default "Must be a valid URL or JSON string";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
