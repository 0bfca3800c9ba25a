package br.fluitax.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when request validation fails.
 */
public class ValidationException extends FluitaxException {

    public ValidationException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "FLUITAX_ERR_400");
    }

    public ValidationException(String field, String message) {
        super(
            String.format("Validation failed for '%s': %s", field, message),
            HttpStatus.BAD_REQUEST,
            "FLUITAX_ERR_400"
        );
    }
}
