package com.example.programmers.validator;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Class-level check that a supplied password confirmation equals the password.
 * The violation is reported on the {@code passwordConfirmation} property.
 */
@Documented
@Constraint(validatedBy = PasswordConfirmationValidator.class)
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface PasswordConfirmation {
    String message() default "doesn't match Password";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
