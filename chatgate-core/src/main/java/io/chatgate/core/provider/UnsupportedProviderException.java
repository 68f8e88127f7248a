package io.chatgate.core.provider;

import io.chatgate.core.model.ErrorKind;

public final class UnsupportedProviderException extends GatewayException {
    private final String provider;

    public UnsupportedProviderException(String provider) {
        super(ErrorKind.UNSUPPORTED_PROVIDER, "Unsupported provider: " + provider);
        this.provider = provider;
    }

    public String provider() {
        return provider;
    }
}
