package io.github.drompincen.turnstile.protocol.api;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ToolPolicyTest {

    @Test
    void allowAllReturnsPermissivePolicy() {
        ToolPolicy policy = ToolPolicy.allowAll();

        assertThat(policy.allowList()).containsExactly("*");
        assertThat(policy.denyList()).isEmpty();
        assertThat(policy.modeFor("anything")).isEqualTo(ToolPolicy.ApprovalMode.ALLOW);
    }

    @Test
    void defaultPolicyRequiresApproval() {
        assertThat(ToolPolicy.requireApproval().modeFor("file_read"))
                .isEqualTo(ToolPolicy.ApprovalMode.REQUIRE_APPROVAL);
    }

    @Test
    void denyListWinsOverOverrides() {
        ToolPolicy policy = new ToolPolicy(
                List.of("*"),
                List.of("shell_exec"),
                Map.of("shell_exec", ToolPolicy.ApprovalMode.ALLOW));

        assertThat(policy.modeFor("shell_exec")).isEqualTo(ToolPolicy.ApprovalMode.DENY);
    }

    @Test
    void toolOutsideAllowListIsDenied() {
        ToolPolicy policy = new ToolPolicy(
                List.of("file_read"),
                List.of(),
                Map.of("file_read", ToolPolicy.ApprovalMode.ALLOW));

        assertThat(policy.modeFor("file_read")).isEqualTo(ToolPolicy.ApprovalMode.ALLOW);
        assertThat(policy.modeFor("file_write")).isEqualTo(ToolPolicy.ApprovalMode.DENY);
    }
}
