package tech.yump.boundary.config.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Documented
@Constraint(validatedBy = CsrfConfigValidator.class)
@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidCsrfConfig {
    String message() default "Invalid CSRF configuration (boundary.csrf).";
    Class<?>[] groups() default {};
    Class<? extends Payload>[] payload() default {};
}
