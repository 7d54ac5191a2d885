package com.postq.internal;

import com.postq.RenderMode;
import com.postq.RenderedContent;
import com.postq.ScheduledMessage;
import com.postq.config.PostQProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the caption sent to every target: the title in bold, then the body on
 * its own line.
 */
@Component
public class ContentRenderer {

    private final int maxImages;

    public ContentRenderer(PostQProperties properties) {
        this.maxImages = Math.max(1, properties.getDelivery().getMaxImagesPerMessage());
    }

    public RenderedContent render(ScheduledMessage message) {
        RenderMode mode = message.getRenderMode() == null ? RenderMode.HTML : message.getRenderMode();
        String title = message.getTitle() == null ? "" : message.getTitle().strip();
        String body = message.getBody() == null ? "" : message.getBody().strip();

        String text = switch (mode) {
            case HTML -> join("<b>" + escapeHtml(title) + "</b>", escapeHtml(body));
            case MARKDOWN -> join("**" + title + "**", body);
            case NONE -> join(title, body);
        };

        List<String> images = message.getImageUrls() == null ? List.of() : message.getImageUrls();
        if (images.size() > maxImages) {
            images = images.subList(0, maxImages);
        }
        return new RenderedContent(text, mode, images, !message.isDisablePreview());
    }

    private String join(String heading, String body) {
        return body.isEmpty() ? heading : heading + "\n" + body;
    }

    static String escapeHtml(String raw) {
        StringBuilder escaped = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#x27;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
