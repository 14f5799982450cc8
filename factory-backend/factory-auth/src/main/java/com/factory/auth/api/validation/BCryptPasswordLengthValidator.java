package com.factory.auth.api.validation;

import com.factory.auth.domain.service.BCryptPasswordHasher;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class BCryptPasswordLengthValidator implements ConstraintValidator<BCryptPasswordLength, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || BCryptPasswordHasher.fitsBCryptInput(value);
    }
}
