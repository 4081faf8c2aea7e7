package tech.noetzold.waf_api.client;

public class ClassifyCallException extends RuntimeException {

    public ClassifyCallException(String message) {
        super(message);
    }

    public ClassifyCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
