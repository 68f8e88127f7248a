package io.chatgate.core.provider;

import io.chatgate.core.model.ErrorKind;

/**
 * Base of every failure the gateway reports to its callers.
 */
public abstract class GatewayException extends RuntimeException {
    private final ErrorKind kind;

    protected GatewayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected GatewayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
