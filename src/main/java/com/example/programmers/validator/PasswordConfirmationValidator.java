package com.example.programmers.validator;

import com.example.programmers.dto.ProgrammerForm;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.Objects;

public class PasswordConfirmationValidator implements ConstraintValidator<PasswordConfirmation, ProgrammerForm> {

    @Override
    public boolean isValid(ProgrammerForm form, ConstraintValidatorContext context) {
        if (form == null || form.getPasswordConfirmation() == null) {
            return true; // Confirmation is optional
        }
        if (Objects.equals(form.getPassword(), form.getPasswordConfirmation())) {
            return true;
        }
        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(context.getDefaultConstraintMessageTemplate())
                .addPropertyNode("passwordConfirmation")
                .addConstraintViolation();
        return false;
    }
}
