package io.chatgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamingConfig(
    @JsonAlias({"simulated_delay_ms"}) long simulatedDelayMs
) {

    public static StreamingConfig defaults() {
        return new StreamingConfig(50);
    }
}
