package io.chatgate.core.provider;

import io.chatgate.core.model.ErrorKind;

/**
 * Non-2xx answer from a provider. Carries the raw body untouched.
 */
public final class ProviderHttpException extends GatewayException {
    private final Provider provider;
    private final int statusCode;
    private final String body;

    public ProviderHttpException(Provider provider, int statusCode, String body) {
        super(ErrorKind.PROVIDER_HTTP, provider.displayName() + " API Error: HTTP " + statusCode + " " + truncate(body));
        this.provider = provider;
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
    }

    public Provider provider() {
        return provider;
    }

    public int statusCode() {
        return statusCode;
    }

    public String body() {
        return body;
    }

    private static String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= 300 ? value : value.substring(0, 300) + "...";
    }
}
