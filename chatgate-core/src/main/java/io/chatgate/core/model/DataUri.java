package io.chatgate.core.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record DataUri(String mimeType, String base64Data) {
    private static final Pattern DATA_URI = Pattern.compile("^data:([^;]+);base64,(.+)$");

    public static Optional<DataUri> parse(String url) {
        if (url == null) {
            return Optional.empty();
        }
        Matcher matcher = DATA_URI.matcher(url);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new DataUri(matcher.group(1), matcher.group(2)));
    }
}
