package com.factory.auth.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated password must fit the UTF-8 byte limit BCrypt reads. Null values are left to
 * {@code @NotBlank}.
 */
@Documented
@Constraint(validatedBy = BCryptPasswordLengthValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface BCryptPasswordLength {

    String message() default "Password must not exceed 72 bytes";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
