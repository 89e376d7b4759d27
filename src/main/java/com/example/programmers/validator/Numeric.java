package com.example.programmers.validator;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated string must hold a whole number that fits in an {@code int}.
 * {@code null} and blank values are accepted; combine with {@code @NotBlank} to require a value.
 */
@Documented
@Constraint(validatedBy = NumericValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface Numeric {
    String message() default "is not a number";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
