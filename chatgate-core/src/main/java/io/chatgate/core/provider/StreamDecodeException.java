package io.chatgate.core.provider;

import io.chatgate.core.model.ErrorKind;

/**
 * The stream as a whole could not be decoded. A single unparsable {@code data:} line is not this.
 */
public final class StreamDecodeException extends GatewayException {

    public StreamDecodeException(String message) {
        super(ErrorKind.STREAM_DECODE, message);
    }
}
