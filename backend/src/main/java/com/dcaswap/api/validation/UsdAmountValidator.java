package com.dcaswap.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.math.BigDecimal;
import java.util.regex.Pattern;

public class UsdAmountValidator implements ConstraintValidator<UsdAmount, String> {

    private static final Pattern TWO_DECIMALS = Pattern.compile("^\\d*\\.?\\d{1,2}$");

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null || !TWO_DECIMALS.matcher(value).matches()) {
            return false;
        }
        return new BigDecimal(value).compareTo(BigDecimal.ONE) >= 0;
    }
}
