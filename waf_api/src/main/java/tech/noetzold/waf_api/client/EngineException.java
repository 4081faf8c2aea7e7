package tech.noetzold.waf_api.client;

/**
 * Failure talking to an external language engine, categorised so callers can decide
 * whether to degrade, fall back or just log.
 */
public class EngineException extends RuntimeException {

    public enum ErrorType {
        AUTH_FAILURE,
        RATE_LIMITED,
        TIMEOUT,
        CONNECTION_ERROR,
        PARSE_ERROR,
        NOT_CONFIGURED
    }

    private final ErrorType errorType;

    public EngineException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public EngineException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
