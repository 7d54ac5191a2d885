package com.postq;

import java.util.List;
import java.util.Objects;

/**
 * What a scheduled message says.
 *
 * @param title          shown in bold on the first line, required
 * @param body           optional text below the title
 * @param imageUrls      images sent as an album, capped by {@code postq.delivery.max-images-per-message}
 * @param renderMode     markup used for the caption
 * @param disablePreview whether link previews are suppressed
 */
public record MessageContent(
        String title,
        String body,
        List<String> imageUrls,
        RenderMode renderMode,
        boolean disablePreview) {

    public MessageContent {
        if (imageUrls != null && imageUrls.stream().anyMatch(Objects::isNull)) {
            throw new MessageValidationException("Image URLs must not contain null");
        }
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
        renderMode = renderMode == null ? RenderMode.HTML : renderMode;
    }

    public static MessageContent of(String title, String body) {
        return new MessageContent(title, body, List.of(), RenderMode.HTML, true);
    }
}
