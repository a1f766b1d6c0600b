package com.dcaswap.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

public class EvmAddressValidator implements ConstraintValidator<EvmAddress, String> {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[a-fA-F0-9]{40}$");

    public static boolean isEvmAddress(String value) {
        return value != null && EVM_ADDRESS.matcher(value).matches();
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return isEvmAddress(value);
    }
}
