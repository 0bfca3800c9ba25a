package br.fluitax.kardex.repository;

import br.fluitax.common.exception.ExternalServiceException;
import com.google.api.core.ApiFuture;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounded wait on Firestore futures.
 *
 * A failed or slow read aborts the report: an empty or partial history would
 * produce a wrong ledger instead of an error.
 */
final class FirestoreReads {

    static final String SERVICE_NAME = "firestore";

    private FirestoreReads() {
        // Utility class - no instantiation
    }

    static <T> T await(ApiFuture<T> future, int timeoutSeconds, String what) {
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ExternalServiceException(SERVICE_NAME, "Interrupted while reading " + what, e);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExternalServiceException(SERVICE_NAME,
                    "Reading " + what + " exceeded " + timeoutSeconds + "s", e);
        } catch (ExecutionException e) {
            throw new ExternalServiceException(SERVICE_NAME,
                    "Error reading " + what + ": " + e.getMessage(), e.getCause());
        }
    }
}
