package io.github.drompincen.turnstile.protocol.api;

import java.util.List;
import java.util.Map;

public record ToolPolicy(
        List<String> allowList,
        List<String> denyList,
        Map<String, ApprovalMode> approvalOverrides,
        ApprovalMode defaultMode
) {
    public enum ApprovalMode {
        ALLOW,
        REQUIRE_APPROVAL,
        DENY
    }

    public ToolPolicy {
        allowList = allowList == null ? List.of("*") : List.copyOf(allowList);
        denyList = denyList == null ? List.of() : List.copyOf(denyList);
        approvalOverrides = approvalOverrides == null ? Map.of() : Map.copyOf(approvalOverrides);
        if (defaultMode == null) {
            defaultMode = ApprovalMode.REQUIRE_APPROVAL;
        }
    }

    public ToolPolicy(List<String> allowList, List<String> denyList, Map<String, ApprovalMode> approvalOverrides) {
        this(allowList, denyList, approvalOverrides, ApprovalMode.REQUIRE_APPROVAL);
    }

    public static ToolPolicy requireApproval() {
        return new ToolPolicy(List.of("*"), List.of(), Map.of(), ApprovalMode.REQUIRE_APPROVAL);
    }

    public static ToolPolicy allowAll() {
        return new ToolPolicy(List.of("*"), List.of(), Map.of(), ApprovalMode.ALLOW);
    }

    /**
     * Resolves the mode for a tool. The deny list wins over everything, a tool missing from the
     * allow list is denied, then per-tool overrides apply, then the default.
     */
    public ApprovalMode modeFor(String toolName) {
        if (denyList.contains(toolName)) {
            return ApprovalMode.DENY;
        }
        if (!allowList.contains("*") && !allowList.contains(toolName)) {
            return ApprovalMode.DENY;
        }
        return approvalOverrides.getOrDefault(toolName, defaultMode);
    }
}
