package com.logstore.common.exception;

/**
 * Error codes for categorizing different types of failures.
 * Error codes are organized by category:
 * - 1xxx: Client errors
 * - 3xxx: Registry errors
 * - 4xxx: Network errors
 */
public enum ErrorCode {

    // Client errors (1xxx)
    INVALID_REQUEST(1001, "Invalid request parameters"),
    INVALID_EVENT(1002, "Malformed assignment event"),
    INVALID_UNIT_KEY(1003, "Malformed stream partition identifier"),

    // Registry errors (3xxx)
    REGISTRY_UNAVAILABLE(3001, "Registry is unavailable"),
    STREAM_NOT_FOUND(3002, "Stream does not exist in the registry"),
    INVALID_STREAM_METADATA(3003, "Registry returned invalid stream metadata"),

    // Network errors (4xxx)
    NETWORK_TIMEOUT(4001, "Network operation timed out"),

    // Unknown errors
    UNKNOWN_ERROR(9999, "Unknown error occurred");

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public static ErrorCode fromCode(int code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code == code) {
                return errorCode;
            }
        }
        return UNKNOWN_ERROR;
    }
}
