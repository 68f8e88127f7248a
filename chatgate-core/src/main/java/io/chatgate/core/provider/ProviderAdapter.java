package io.chatgate.core.provider;

import io.chatgate.core.model.GenerationResult;
import io.chatgate.core.model.Turn;
import io.chatgate.core.stream.DeltaSource;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import okhttp3.Request;

/**
 * Provider-specific request shaping, response parsing and stream decoding.
 */
public interface ProviderAdapter {

    Provider provider();

    List<Map<String, Object>> normalize(List<Turn> turns);

    Request buildRequest(ProviderCall call, boolean stream);

    GenerationResult parseFull(String body, String requestedModel);

    /**
     * Single non-streaming request.
     */
    GenerationResult complete(ProviderCall call);

    /**
     * Opens the provider call and returns its deltas. The caller owns the returned source.
     */
    DeltaSource decodeStream(ProviderCall call) throws IOException;
}
