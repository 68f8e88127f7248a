package io.chatgate.core.provider;

import io.chatgate.core.model.GenerationOptions;
import io.chatgate.core.model.Turn;
import java.util.List;
import java.util.Objects;

/**
 * Everything one outbound provider request needs, with the model already resolved to its literal id.
 */
public record ProviderCall(
    ProviderDescriptor descriptor,
    String model,
    List<Turn> turns,
    GenerationOptions options,
    String apiKey
) {

    public ProviderCall {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(model, "model must not be null");
        turns = turns == null ? List.of() : List.copyOf(turns);
        options = options == null ? GenerationOptions.defaults() : options;
        apiKey = apiKey == null ? "" : apiKey;
    }

    public Provider provider() {
        return descriptor.provider();
    }

    public boolean hasImages() {
        return turns.stream().anyMatch(Turn::hasImages);
    }

    @Override
    public String toString() {
        return "ProviderCall[provider=" + provider().key() + ", model=" + model + ", turns=" + turns.size() + "]";
    }
}
