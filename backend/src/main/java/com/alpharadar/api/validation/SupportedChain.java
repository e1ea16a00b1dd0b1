package com.alpharadar.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Chain key accepted by {@link com.alpharadar.domain.Chain#fromKey(String)}. Null passes; pair with @NotBlank.
 * Error code for API: INVALID_CHAIN.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = SupportedChainValidator.class)
public @interface SupportedChain {

    String message() default "INVALID_CHAIN";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
