package com.jobly.board.api;

import com.jobly.board.error.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks request payloads against their declared constraints and reports every violation
 * in one {@link ValidationException}.
 */
@Component
public class RequestValidator {
    private final Validator validator;

    public RequestValidator(Validator validator) {
        this.validator = validator;
    }

    public <T> T validate(T payload) {
        if (payload == null) {
            throw new ValidationException("Request body is required");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                .sorted()
                .collect(Collectors.joining("; "));
            throw new ValidationException(message);
        }
        return payload;
    }
}
