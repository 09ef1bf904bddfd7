package io.github.drompincen.turnstile.protocol.event;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventTypeTest {

    @Test
    void everyTypeMapsToItsPayload() {
        assertThat(EventType.USER_MESSAGE.dataClass()).isEqualTo(UserMessageData.class);
        assertThat(EventType.TOOL_RESULT.dataClass()).isEqualTo(ToolResultData.class);
        assertThat(EventType.TOOL_APPROVAL_RESPONSE.dataClass()).isEqualTo(ToolApprovalResponseData.class);
        assertThat(new LocalSystemMessageData("x").type()).isEqualTo(EventType.LOCAL_SYSTEM_MESSAGE);
    }

    @Test
    void eventTakesTypeFromPayloadWhenMissing() {
        Event event = new Event("e1", "t1", 1, null, null, new UserMessageData("hi"));

        assertThat(event.type()).isEqualTo(EventType.USER_MESSAGE);
        assertThat(event.dataAs(UserMessageData.class).content()).isEqualTo("hi");
    }

    @Test
    void eventRejectsMismatchedPayload() {
        assertThatThrownBy(() -> new Event("e1", "t1", 1, EventType.AGENT_MESSAGE, null, new UserMessageData("hi")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void onlyCompletedResultsAreNotErrors() {
        assertThat(ToolResultData.completed("c1", "ok").isError()).isFalse();
        assertThat(ToolResultData.failed("c1", "boom").isError()).isTrue();
        assertThat(ToolResultData.denied("c1", "no").isError()).isTrue();
        assertThat(ToolResultData.aborted("c1").isError()).isTrue();
    }
}
