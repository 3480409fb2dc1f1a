package io.turnstile.core.content;

import static org.assertj.core.api.Assertions.assertThat;

import io.turnstile.core.model.ContentBlock;
import io.turnstile.core.model.MessageContent;
import io.turnstile.core.model.ToolCall;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResponseNormalizerTest {

    private static final ToolCall CALL = new ToolCall("call_1", "analyze_product", Map.of());

    @Test
    void shouldPassPlainTextThrough() {
        assertThat(ResponseNormalizer.extractText(MessageContent.text("Hello"))).isEqualTo("Hello");
        assertThat(ResponseNormalizer.extractText((MessageContent) null)).isEmpty();
    }

    @Test
    void shouldConcatenateTextBlocksAndSkipToolRequests() {
        MessageContent content = MessageContent.blocks(List.of(
            ContentBlock.text("Before. "),
            ContentBlock.toolRequest(CALL),
            ContentBlock.text("After.")
        ));

        assertThat(ResponseNormalizer.extractText(content)).isEqualTo("Before. After.");
    }

    @Test
    void shouldReturnEmptyStringForBlocksWithoutText() {
        MessageContent content = MessageContent.blocks(List.of(ContentBlock.toolRequest(CALL)));

        assertThat(ResponseNormalizer.extractText(content)).isEmpty();
        assertThat(ResponseNormalizer.extractText(MessageContent.blocks(List.of()))).isEmpty();
    }

    @Test
    void shouldLimitLeadingTextToBlocksBeforeFirstToolRequest() {
        MessageContent content = MessageContent.blocks(List.of(
            ContentBlock.text("Who is it for?"),
            ContentBlock.toolRequest(CALL),
            ContentBlock.text("Ignored?")
        ));

        assertThat(ResponseNormalizer.leadingText(content)).isEqualTo("Who is it for?");
        assertThat(ResponseNormalizer.leadingText(MessageContent.text("plain"))).isEqualTo("plain");
    }
}
