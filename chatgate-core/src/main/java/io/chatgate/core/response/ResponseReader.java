package io.chatgate.core.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatgate.core.provider.MalformedResponseException;
import java.util.List;

final class ResponseReader {

    private ResponseReader() {
    }

    static <T> T read(ObjectMapper mapper, String body, Class<T> type, String provider) {
        if (body == null || body.isBlank()) {
            throw new MalformedResponseException(provider + " returned an empty body");
        }
        try {
            T value = mapper.readValue(body, type);
            if (value == null) {
                throw new MalformedResponseException(provider + " returned a null body");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(provider + " returned a body that is not valid JSON", e);
        }
    }

    static <T> T first(List<T> items, String path) {
        if (items == null || items.isEmpty() || items.get(0) == null) {
            throw new MalformedResponseException("response is missing " + path);
        }
        return items.get(0);
    }
}
