package io.datahub.cache;

/**
 * Raised when the backing store of a {@link KeyValueCache} cannot be written.
 */
public class CacheAccessException extends RuntimeException {

    public CacheAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
