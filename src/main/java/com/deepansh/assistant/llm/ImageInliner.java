package com.deepansh.assistant.llm;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;

/**
 * Turns image references from message content into something a provider can
 * receive. Local files are read and base64-encoded; remote URLs and data URIs
 * pass through untouched.
 */
@Component
public class ImageInliner {

    private static final Map<String, String> MEDIA_TYPES = Map.of(
            "png", "image/png",
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "gif", "image/gif",
            "webp", "image/webp",
            "bmp", "image/bmp"
    );

    public record InlineImage(String url, String mediaType, String base64Data) {

        public boolean isRemote() {
            return base64Data == null;
        }

        public String toDataUri() {
            return isRemote() ? url : "data:" + mediaType + ";base64," + base64Data;
        }
    }

    public InlineImage resolve(String reference) throws IOException {
        if (reference == null || reference.isBlank()) {
            throw new IOException("empty image reference");
        }
        String lower = reference.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return new InlineImage(reference, null, null);
        }
        if (lower.startsWith("data:")) {
            int comma = reference.indexOf(',');
            int semicolon = reference.indexOf(';');
            if (comma < 0 || semicolon < 0 || semicolon > comma) {
                throw new IOException("malformed data URI");
            }
            return new InlineImage(reference, reference.substring(5, semicolon), reference.substring(comma + 1));
        }

        Path path = Path.of(reference);
        if (!Files.isRegularFile(path)) {
            throw new IOException("image file not found: " + reference);
        }
        byte[] bytes = Files.readAllBytes(path);
        return new InlineImage(reference, mediaTypeOf(path), Base64.getEncoder().encodeToString(bytes));
    }

    static String mediaTypeOf(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String extension = dot >= 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        return MEDIA_TYPES.getOrDefault(extension, "image/png");
    }
}
