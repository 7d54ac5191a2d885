package com.postq;

import java.util.List;

/**
 * Message content as handed to the transport.
 *
 * @param text        caption or message text, formatted for {@code renderMode}
 * @param renderMode  how the platform should parse {@code text}
 * @param imageUrls   images to attach as an album, already capped to the platform limit
 * @param linkPreview whether the platform may render link previews
 */
public record RenderedContent(String text, RenderMode renderMode, List<String> imageUrls, boolean linkPreview) {

    public RenderedContent {
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
    }

    public boolean hasImages() {
        return !imageUrls.isEmpty();
    }
}
