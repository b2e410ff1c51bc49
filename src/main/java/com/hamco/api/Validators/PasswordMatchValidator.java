package com.hamco.api.Validators;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.beans.BeanWrapperImpl;

import java.util.Objects;

public class PasswordMatchValidator implements ConstraintValidator<PasswordMatch, Object> {

    private String passwordField;
    private String passwordConfirmationField;

    @Override
    public void initialize(PasswordMatch constraint) {
        this.passwordField = constraint.passwordField();
        this.passwordConfirmationField = constraint.passwordConfirmationField();
    }

    @Override
    public boolean isValid(Object value, ConstraintValidatorContext context) {
        if (value == null) return true;
        BeanWrapperImpl bean = new BeanWrapperImpl(value);
        Object password = bean.getPropertyValue(passwordField);
        Object confirmation = bean.getPropertyValue(passwordConfirmationField);
        // Missing values are reported by @NotBlank on the fields themselves
        if (password == null || confirmation == null) return true;
        if (Objects.equals(password, confirmation)) return true;

        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(context.getDefaultConstraintMessageTemplate())
                .addPropertyNode(passwordConfirmationField)
                .addConstraintViolation();
        return false;
    }
}
