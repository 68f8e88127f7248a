package io.chatgate.core.provider;

import io.chatgate.core.model.ErrorKind;

public final class MalformedResponseException extends GatewayException {

    public MalformedResponseException(String message) {
        super(ErrorKind.MALFORMED_RESPONSE, message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_RESPONSE, message, cause);
    }
}
