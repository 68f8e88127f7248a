package io.chatgate.core.api;

import java.util.Objects;

/**
 * One file part of a multipart message upload.
 */
record UploadedImage(String fileName, String mimeType, byte[] bytes) {

    UploadedImage {
        Objects.requireNonNull(bytes, "bytes must not be null");
        fileName = fileName == null ? "" : fileName;
        mimeType = mimeType == null ? "" : mimeType;
    }
}
