package br.fluitax.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when the set of companies taking part in the consolidated Kardex
 * cannot be determined exactly (unknown IDs/CNPJs, missing participant).
 *
 * The report is never built over a partial company set.
 */
public class KardexConfigurationException extends FluitaxException {

    public KardexConfigurationException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "FLUITAX_ERR_400_CONFIG");
    }
}
