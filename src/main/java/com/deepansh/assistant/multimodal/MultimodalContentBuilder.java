package com.deepansh.assistant.multimodal;

import com.deepansh.assistant.model.ContentPart;
import com.deepansh.assistant.model.MessageContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.InvalidPathException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds user message content from raw text and an optional image reference.
 *
 * An image may be referenced inline as {@code [image:/path/to/file.png]} or
 * {@code <image:/path/to/file.png>} anywhere in the text. The marker is removed
 * from the text. A reference to a local file that does not exist degrades to
 * plain text with a warning line; remote URLs are not checked.
 */
@Component
@Slf4j
public class MultimodalContentBuilder {

    private static final Pattern IMAGE_MARKER = Pattern.compile("[\\[<]image:([^\\]>]+)[\\]>]");

    public record ParsedInput(String text, String imagePath) {

        public boolean hasImage() {
            return imagePath != null;
        }
    }

    /** Extracts the first inline image marker. Text comes back trimmed with markers removed. */
    public ParsedInput parse(String rawText) {
        if (rawText == null) {
            return new ParsedInput("", null);
        }
        Matcher m = IMAGE_MARKER.matcher(rawText);
        if (!m.find()) {
            return new ParsedInput(rawText.trim(), null);
        }
        String imagePath = m.group(1).trim();
        String text = IMAGE_MARKER.matcher(rawText).replaceAll("").trim();
        return new ParsedInput(text, imagePath.isEmpty() ? null : imagePath);
    }

    public MessageContent build(String text, String imagePath, boolean multimodalEnabled) {
        String safeText = text != null ? text : "";
        if (imagePath == null || imagePath.isBlank() || !multimodalEnabled) {
            return MessageContent.text(safeText);
        }

        if (!isRemote(imagePath) && !localFileExists(imagePath)) {
            log.warn("Referenced image does not exist: {}", imagePath);
            return MessageContent.text(safeText + "\n[注意: 图片文件不存在: " + imagePath + "]");
        }

        List<ContentPart> parts = new ArrayList<>();
        if (!safeText.isBlank()) {
            parts.add(ContentPart.text(safeText));
        }
        parts.add(ContentPart.image(imagePath));
        return MessageContent.ofParts(parts);
    }

    private static boolean isRemote(String reference) {
        String lower = reference.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://") || lower.startsWith("data:");
    }

    private static boolean localFileExists(String reference) {
        try {
            return Files.exists(Path.of(reference));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
