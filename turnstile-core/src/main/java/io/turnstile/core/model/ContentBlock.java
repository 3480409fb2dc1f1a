package io.turnstile.core.model;

import java.util.Objects;

/**
 * One element of a block-structured message body. A block is either displayable text or a
 * request from the completion engine to invoke a tool.
 */
public sealed interface ContentBlock permits ContentBlock.Text, ContentBlock.ToolRequest {

    static ContentBlock text(String text) {
        return new Text(text);
    }

    static ContentBlock toolRequest(ToolCall call) {
        return new ToolRequest(call);
    }

    record Text(String text) implements ContentBlock {
        public Text {
            text = text == null ? "" : text;
        }
    }

    record ToolRequest(ToolCall call) implements ContentBlock {
        public ToolRequest {
            Objects.requireNonNull(call, "call must not be null");
        }
    }
}
