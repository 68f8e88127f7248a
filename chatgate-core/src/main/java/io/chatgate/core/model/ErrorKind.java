package io.chatgate.core.model;

public enum ErrorKind {
    UNSUPPORTED_PROVIDER,
    PROVIDER_HTTP,
    MALFORMED_RESPONSE,
    STREAM_DECODE,
    TRANSPORT
}
