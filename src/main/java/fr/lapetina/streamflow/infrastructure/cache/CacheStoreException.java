package fr.lapetina.streamflow.infrastructure.cache;

/**
 * Failure of a {@link CacheStore} backend.
 */
public class CacheStoreException extends RuntimeException {

    public CacheStoreException(String message) {
        super(message);
    }

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
