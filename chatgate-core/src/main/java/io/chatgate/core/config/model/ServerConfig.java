package io.chatgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerConfig(
    String host,
    int port,
    @JsonAlias({"api_token"}) String apiToken
) {

    public static ServerConfig defaults() {
        return new ServerConfig("0.0.0.0", 8787, "");
    }

    @Override
    public String toString() {
        boolean tokenSet = apiToken != null && !apiToken.isBlank();
        return "ServerConfig[host=" + host + ", port=" + port + ", apiToken=" + (tokenSet ? "***" : "") + "]";
    }
}
