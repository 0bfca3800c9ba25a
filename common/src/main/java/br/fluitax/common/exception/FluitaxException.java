package br.fluitax.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception for all FluiTax business exceptions.
 */
@Getter
public class FluitaxException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public FluitaxException(String message) {
        super(message);
        this.status = HttpStatus.INTERNAL_SERVER_ERROR;
        this.errorCode = "FLUITAX_ERR_001";
    }

    public FluitaxException(String message, HttpStatus status) {
        super(message);
        this.status = status;
        this.errorCode = "FLUITAX_ERR_001";
    }

    public FluitaxException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public FluitaxException(String message, Throwable cause) {
        super(message, cause);
        this.status = HttpStatus.INTERNAL_SERVER_ERROR;
        this.errorCode = "FLUITAX_ERR_001";
    }
}
