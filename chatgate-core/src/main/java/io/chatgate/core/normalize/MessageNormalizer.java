package io.chatgate.core.normalize;

import io.chatgate.core.model.Turn;
import java.util.List;
import java.util.Map;

/**
 * Shapes the shared turn list into one provider's request representation.
 */
public interface MessageNormalizer {

    List<Map<String, Object>> normalize(List<Turn> turns);
}
