package io.chatgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    @JsonAlias({"sqlite_path"}) String sqlitePath
) {

    public static StorageConfig defaults() {
        return new StorageConfig("~/.chatgate/conversations.db");
    }
}
