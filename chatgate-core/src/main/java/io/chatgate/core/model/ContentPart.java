package io.chatgate.core.model;

import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * One element of a multi-part turn: either text or an inline image.
 */
public sealed interface ContentPart permits ContentPart.Text, ContentPart.Image {

    static Text text(String text) {
        return new Text(text);
    }

    static Image image(String url) {
        return new Image(url);
    }

    record Text(String text) implements ContentPart {
        public Text {
            text = text == null ? "" : text;
        }
    }

    /**
     * Image carried as a {@code data:<mime>;base64,<payload>} URI.
     */
    record Image(String url) implements ContentPart {
        public Image {
            Objects.requireNonNull(url, "url must not be null");
        }

        public static Image of(String mimeType, String base64Data) {
            return new Image("data:" + mimeType + ";base64," + base64Data);
        }

        public static Image fromBytes(String mimeType, byte[] bytes) {
            return of(mimeType, Base64.getEncoder().encodeToString(bytes));
        }

        public Optional<DataUri> dataUri() {
            return DataUri.parse(url);
        }
    }
}
