package com.logstore.common.exception;

/**
 * Exception thrown when a registry query fails.
 */
public class RegistryException extends LogStoreException {

    public RegistryException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public RegistryException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    @Override
    public RegistryException withDetail(String key, Object value) {
        super.withDetail(key, value);
        return this;
    }
}
