package io.turnstile.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Message body as produced by the completion engine: either a plain string or an ordered list
 * of content blocks. Consumers switch on the variant explicitly; nothing here renders the block
 * structure as text.
 */
public sealed interface MessageContent permits MessageContent.PlainText, MessageContent.Blocks {

    static MessageContent text(String text) {
        return new PlainText(text);
    }

    static MessageContent blocks(List<ContentBlock> blocks) {
        return new Blocks(blocks);
    }

    /**
     * Tool invocation requests in block order. Plain text never carries requests.
     */
    List<ToolCall> toolCalls();

    record PlainText(String text) implements MessageContent {
        public PlainText {
            text = text == null ? "" : text;
        }

        @Override
        public List<ToolCall> toolCalls() {
            return List.of();
        }
    }

    record Blocks(List<ContentBlock> blocks) implements MessageContent {
        public Blocks {
            blocks = blocks == null ? List.of() : List.copyOf(blocks);
        }

        @Override
        public List<ToolCall> toolCalls() {
            List<ToolCall> calls = new ArrayList<>();
            for (ContentBlock block : blocks) {
                if (block instanceof ContentBlock.ToolRequest request) {
                    calls.add(request.call());
                }
            }
            return List.copyOf(calls);
        }
    }
}
