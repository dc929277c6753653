package com.llmbridge.gateway.encoder;

import com.llmbridge.gateway.dto.canonical.BlockKind;
import com.llmbridge.gateway.dto.canonical.CanonicalResponse;
import com.llmbridge.gateway.dto.canonical.ContentPart;
import com.llmbridge.gateway.dto.canonical.FinishReason;
import com.llmbridge.gateway.dto.canonical.StreamEvent;
import com.llmbridge.gateway.dto.canonical.ToolCall;
import com.llmbridge.gateway.dto.canonical.Usage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseAggregatorTest {

    @Test
    void shouldCollectBlocksIntoResponse() {
        ResponseAggregator aggregator = new ResponseAggregator();
        List.of(
                StreamEvent.BlockStart.of(0, BlockKind.THINKING),
                new StreamEvent.ThinkingDelta(0, "a"),
                new StreamEvent.ThinkingDelta(0, "b"),
                new StreamEvent.ThinkingSignature(0, "sig"),
                new StreamEvent.BlockStop(0),
                StreamEvent.BlockStart.of(1, BlockKind.TEXT),
                new StreamEvent.TextDelta(1, "Hello"),
                new StreamEvent.BlockStop(1),
                new StreamEvent.BlockStart(2, BlockKind.TOOL_USE, "c1", "f"),
                new StreamEvent.ToolArgumentDelta(2, "c1", "{\"k\":"),
                new StreamEvent.ToolArgumentDelta(2, "c1", "true}"),
                new StreamEvent.BlockStop(2),
                StreamEvent.MessageFinish.of(FinishReason.TOOL_USE, new Usage(7, 8))
        ).forEach(aggregator::accept);

        CanonicalResponse response = aggregator.toResponse("id-1", "m");

        assertThat(aggregator.isFinished()).isTrue();
        assertThat(response.content()).containsExactly(
                new ContentPart.Thinking("ab", "sig"),
                new ContentPart.Text("Hello"),
                new ContentPart.ToolUse(new ToolCall("c1", "f", "{\"k\":true}")));
        assertThat(response.finishReason()).isEqualTo(FinishReason.TOOL_USE);
        assertThat(response.usage()).isEqualTo(new Usage(7, 8));
    }

    @Test
    void shouldKeepEmptyTextBlock() {
        ResponseAggregator aggregator = new ResponseAggregator();
        aggregator.accept(StreamEvent.BlockStart.of(0, BlockKind.TEXT));
        aggregator.accept(new StreamEvent.BlockStop(0));

        assertThat(aggregator.isFinished()).isFalse();
        assertThat(aggregator.finish()).isNull();
        assertThat(aggregator.toResponse("id", "m").content()).containsExactly(new ContentPart.Text(""));
    }
}
