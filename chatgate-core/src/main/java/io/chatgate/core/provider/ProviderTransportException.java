package io.chatgate.core.provider;

import io.chatgate.core.model.ErrorKind;
import java.io.IOException;

public final class ProviderTransportException extends GatewayException {

    public ProviderTransportException(Provider provider, IOException cause) {
        super(
            ErrorKind.TRANSPORT,
            "Error calling " + provider.displayName() + ": " + (cause.getMessage() == null ? "I/O failure" : cause.getMessage()),
            cause
        );
    }
}
