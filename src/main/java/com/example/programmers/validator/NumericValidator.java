package com.example.programmers.validator;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

public class NumericValidator implements ConstraintValidator<Numeric, String> {
    // Optional sign followed by digits, surrounding whitespace allowed
    private static final String INTEGER_REGEX = "^\\s*[+-]?\\d+\\s*$";
    private static final Pattern INTEGER_PATTERN = Pattern.compile(INTEGER_REGEX);

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null || value.trim().isEmpty()) {
            return true; // Presence is checked by @NotBlank
        }
        if (!INTEGER_PATTERN.matcher(value).matches()) {
            return false;
        }
        try {
            Integer.parseInt(value.trim());
            return true;
        } catch (NumberFormatException e) {
            return false; // Out of int range
        }
    }
}
