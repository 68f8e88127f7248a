package io.chatgate.core.api;

import io.chatgate.core.model.ErrorKind;

final class ErrorStatus {

    private ErrorStatus() {
    }

    static int forKind(ErrorKind kind) {
        return switch (kind) {
            case UNSUPPORTED_PROVIDER -> 400;
            case PROVIDER_HTTP, MALFORMED_RESPONSE, STREAM_DECODE -> 502;
            case TRANSPORT -> 504;
        };
    }
}
