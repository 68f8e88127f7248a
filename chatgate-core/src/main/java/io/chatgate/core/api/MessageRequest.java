package io.chatgate.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.chatgate.core.model.ContentPart;
import io.chatgate.core.model.DataUri;
import io.chatgate.core.model.GenerationOptions;
import io.chatgate.core.provider.Provider;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Body of {@code POST /conversations/{id}/messages}. Provider and model are lower-cased and
 * {@code null} when the conversation defaults apply. Streaming is on unless {@code stream} is false.
 */
record MessageRequest(
    String content,
    String modelProvider,
    String modelName,
    GenerationOptions options,
    boolean stream,
    List<String> images
) {
    static final int MAX_IMAGES = 5;
    static final long MAX_IMAGE_BYTES = 10L * 1024 * 1024;
    static final String PROVIDER_MESSAGE =
        "The model provider must be one of: openai, anthropic, deepseek, gemini, mistral.";
    private static final String TYPE_MESSAGE = "Files must be images (jpeg, jpg, png, gif, webp).";
    private static final String SIZE_MESSAGE = "Each file must be smaller than 10MB.";
    private static final Set<String> IMAGE_TYPES = Set.of("image/jpeg", "image/jpg", "image/png", "image/gif", "image/webp");

    static MessageRequest from(JsonNode body) {
        return from(body, List.of());
    }

    /**
     * Reads a message whose images arrive either as {@code images} data URIs in the body or as
     * uploaded files. Both count against the same limit.
     */
    static MessageRequest from(JsonNode body, List<UploadedImage> uploads) {
        RequestValidator validator = new RequestValidator(body);
        String content = validator.requiredString("content", 0);
        String provider = validator.optionalString("model_provider", 50);
        String model = validator.optionalString("model_name", 100);
        if (provider != null && Provider.fromKey(provider).isEmpty()) {
            validator.reject("model_provider", PROVIDER_MESSAGE);
        }
        GenerationOptions options = readOptions(validator);
        boolean stream = validator.optionalBoolean("stream", true);

        List<String> dataUris = validator.optionalStringArray("images");
        List<String> images = new ArrayList<>();
        for (String image : dataUris) {
            Optional<DataUri> dataUri = DataUri.parse(image);
            if (dataUri.isEmpty() || !isImageType(dataUri.get().mimeType())) {
                validator.reject("images", TYPE_MESSAGE);
                break;
            }
            if (decodedLength(dataUri.get().base64Data()) > MAX_IMAGE_BYTES) {
                validator.reject("images", SIZE_MESSAGE);
                break;
            }
            images.add(image);
        }
        for (UploadedImage upload : uploads) {
            if (!isImageType(upload.mimeType())) {
                validator.reject("files", TYPE_MESSAGE);
                break;
            }
            if (upload.bytes().length > MAX_IMAGE_BYTES) {
                validator.reject("files", SIZE_MESSAGE);
                break;
            }
            images.add(ContentPart.Image.fromBytes(upload.mimeType().trim().toLowerCase(Locale.ROOT), upload.bytes()).url());
        }
        if (dataUris.size() + uploads.size() > MAX_IMAGES) {
            validator.reject(uploads.isEmpty() ? "images" : "files", "You can upload a maximum of " + MAX_IMAGES + " files.");
        }
        validator.throwIfInvalid();
        return new MessageRequest(
            content,
            CreateConversationRequest.lower(provider),
            CreateConversationRequest.lower(model),
            options,
            stream,
            List.copyOf(images)
        );
    }

    boolean hasImages() {
        return !images.isEmpty();
    }

    static GenerationOptions readOptions(RequestValidator validator) {
        JsonNode node = validator.optionalObject("options");
        if (node == null) {
            return GenerationOptions.defaults();
        }
        Map<String, Object> raw = new LinkedHashMap<>();
        JsonNode temperature = node.get("temperature");
        if (temperature != null && !temperature.isNull()) {
            if (!temperature.isNumber()) {
                validator.reject("options.temperature", "The options.temperature field must be a number.");
                return GenerationOptions.defaults();
            }
            raw.put("temperature", temperature.doubleValue());
        }
        JsonNode maxTokens = node.has("max_tokens") ? node.get("max_tokens") : node.get("maxTokens");
        if (maxTokens != null && !maxTokens.isNull()) {
            if (!maxTokens.isIntegralNumber()) {
                validator.reject("options.max_tokens", "The options.max_tokens field must be an integer.");
                return GenerationOptions.defaults();
            }
            if (!maxTokens.canConvertToInt()) {
                validator.reject("options.max_tokens", "The options.max_tokens field must be between 1 and 4000.");
                return GenerationOptions.defaults();
            }
            raw.put("max_tokens", maxTokens.intValue());
        }
        try {
            return GenerationOptions.fromMap(raw);
        } catch (IllegalArgumentException e) {
            validator.reject("options", e.getMessage());
            return GenerationOptions.defaults();
        }
    }

    private static boolean isImageType(String mimeType) {
        return mimeType != null && IMAGE_TYPES.contains(mimeType.trim().toLowerCase(Locale.ROOT));
    }

    private static long decodedLength(String base64) {
        return (long) base64.length() * 3 / 4;
    }
}
