package io.turnstile.core.content;

import io.turnstile.core.model.ContentBlock;
import io.turnstile.core.model.MessageContent;
import java.util.List;

/**
 * Flattens engine output into displayable text. Plain text passes through unchanged; block
 * content contributes the payload of its text blocks, in order, and skips everything else.
 */
public final class ResponseNormalizer {

    private ResponseNormalizer() {
    }

    public static String extractText(MessageContent content) {
        if (content == null) {
            return "";
        }
        if (content instanceof MessageContent.PlainText plain) {
            return plain.text();
        }
        if (content instanceof MessageContent.Blocks blocks) {
            return extractText(blocks.blocks());
        }
        throw new IllegalArgumentException("Unsupported content variant: " + content.getClass().getName());
    }

    public static String extractText(String content) {
        return content == null ? "" : content;
    }

    public static String extractText(List<ContentBlock> blocks) {
        StringBuilder text = new StringBuilder();
        for (ContentBlock block : blocks) {
            if (block instanceof ContentBlock.Text textBlock) {
                text.append(textBlock.text());
            }
        }
        return text.toString();
    }

    /**
     * Text emitted before the first tool request. For content without tool requests this is
     * the whole text.
     */
    public static String leadingText(MessageContent content) {
        if (content instanceof MessageContent.Blocks blocks) {
            StringBuilder text = new StringBuilder();
            for (ContentBlock block : blocks.blocks()) {
                if (block instanceof ContentBlock.ToolRequest) {
                    break;
                }
                if (block instanceof ContentBlock.Text textBlock) {
                    text.append(textBlock.text());
                }
            }
            return text.toString();
        }
        return extractText(content);
    }
}
