package com.dcaswap.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * USD amount as a decimal string with at most two decimals and a minimum of 1.00.
 * Error code for API: INVALID_PURCHASE_AMOUNT.
 */
@Target({FIELD, PARAMETER, RECORD_COMPONENT})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = UsdAmountValidator.class)
public @interface UsdAmount {

    String message() default "INVALID_PURCHASE_AMOUNT";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
