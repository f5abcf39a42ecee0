package com.anchorinsights.common.exception;

/**
 * Request-failing error with a caller-safe message.
 *
 * <p>The message is returned to clients as-is, so it must never carry stack traces,
 * connection strings or other internal identifiers. The cause is kept for logging.
 */
public class ApiException extends RuntimeException {

    private final ErrorKind kind;

    public ApiException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ApiException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ApiException notFound(String message) {
        return new ApiException(ErrorKind.NOT_FOUND, message);
    }

    public static ApiException badRequest(String message) {
        return new ApiException(ErrorKind.BAD_REQUEST, message);
    }

    public static ApiException internal(String message, Throwable cause) {
        return new ApiException(ErrorKind.INTERNAL_ERROR, message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }
}
