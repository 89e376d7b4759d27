package com.example.programmers.dto;

import com.example.programmers.validator.Numeric;
import com.example.programmers.validator.PasswordConfirmation;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.ToString;

/**
 * Create/update input, bound from either a JSON body or form-encoded parameters.
 * Every field is a string so both encodings report bad input as field errors.
 */
@Data
@PasswordConfirmation
public class ProgrammerForm {
    public static final int NAME_MAX_LENGTH = 50;
    public static final int PASSWORD_MIN_LENGTH = 6;

    @NotBlank(message = "can't be blank")
    @Size(max = NAME_MAX_LENGTH, message = "is too long (maximum is {max} characters)")
    private String name;

    @NotBlank(message = "can't be blank")
    @Numeric(message = "is not a number")
    private String age;

    @ToString.Exclude
    @NotBlank(groups = OnCreate.class, message = "can't be blank")
    @Size(min = PASSWORD_MIN_LENGTH, message = "is too short (minimum is {min} characters)")
    private String password;

    @ToString.Exclude
    private String passwordConfirmation;

    // Validated and stored without surrounding whitespace
    public void setName(String name) {
        this.name = name == null ? null : name.trim();
    }

    // Blank means "not supplied": on update the stored hash is kept.
    public void setPassword(String password) {
        this.password = blankToNull(password);
    }

    public void setPasswordConfirmation(String passwordConfirmation) {
        this.passwordConfirmation = blankToNull(passwordConfirmation);
    }

    public boolean hasPassword() {
        return password != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value;
    }
}
