package com.alpharadar.api.validation;

import com.alpharadar.domain.Chain;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class SupportedChainValidator implements ConstraintValidator<SupportedChain, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || Chain.fromKey(value).isPresent();
    }
}
