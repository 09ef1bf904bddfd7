package io.github.drompincen.turnstile.protocol.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApprovalDecisionTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void serializesToWireValue() throws Exception {
        assertThat(mapper.writeValueAsString(ApprovalDecision.ALLOW_SESSION)).isEqualTo("\"allow_session\"");
    }

    @Test
    void acceptsWireValueAndEnumName() throws Exception {
        assertThat(mapper.readValue("\"allow_once\"", ApprovalDecision.class)).isEqualTo(ApprovalDecision.ALLOW_ONCE);
        assertThat(ApprovalDecision.fromValue("DENY")).isEqualTo(ApprovalDecision.DENY);
    }

    @Test
    void rejectsUnknownValue() {
        assertThatThrownBy(() -> ApprovalDecision.fromValue("maybe"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void responsePayloadKeepsToolCallId() throws Exception {
        String json = mapper.writeValueAsString(new ToolApprovalResponseData("call_1", ApprovalDecision.DENY));

        assertThat(json).contains("\"toolCallId\":\"call_1\"").contains("\"decision\":\"deny\"");
        assertThat(mapper.readValue(json, ToolApprovalResponseData.class).decision()).isEqualTo(ApprovalDecision.DENY);
    }
}
