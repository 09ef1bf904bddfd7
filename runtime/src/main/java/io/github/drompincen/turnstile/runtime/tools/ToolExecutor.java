package io.github.drompincen.turnstile.runtime.tools;

import io.github.drompincen.turnstile.protocol.api.ToolPolicy;
import io.github.drompincen.turnstile.protocol.event.ContentBlock;
import io.github.drompincen.turnstile.protocol.event.ToolCallData;
import io.github.drompincen.turnstile.protocol.event.ToolResultData;
import io.github.drompincen.turnstile.protocol.event.ToolResultStatus;
import io.github.drompincen.turnstile.runtime.approval.ApprovalGate;
import io.github.drompincen.turnstile.runtime.approval.ApprovalOutcome;
import io.github.drompincen.turnstile.runtime.cancel.TurnCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs tool calls under a {@link ToolPolicy}. Every failure, including an unknown tool or an
 * approval gate error, comes back as a result; nothing is thrown to the caller.
 */
public class ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutor.class);

    private final ToolRegistry registry;
    private final ToolPolicy policy;
    private final ApprovalGate approvalGate;

    public ToolExecutor(ToolRegistry registry, ToolPolicy policy, ApprovalGate approvalGate) {
        this.registry = registry;
        this.policy = policy == null ? ToolPolicy.requireApproval() : policy;
        this.approvalGate = approvalGate;
    }

    public ToolExecution executeTool(ToolCallData call, ToolContext ctx) {
        if (ctx.cancellation().isCancelled()) {
            return ToolExecution.completed(ToolResultData.aborted(call.id()));
        }
        Tool tool = registry.get(call.name()).orElse(null);
        if (tool == null) {
            log.warn("Tool '{}' not found for call {}", call.name(), call.id());
            return ToolExecution.completed(ToolResultData.failed(call.id(), "Tool '" + call.name() + "' not found"));
        }

        ToolPolicy.ApprovalMode mode = policy.modeFor(tool.name());
        if (mode == ToolPolicy.ApprovalMode.DENY) {
            return ToolExecution.completed(ToolResultData.denied(call.id(), "Tool '" + tool.name() + "' is denied by policy"));
        }
        if (tool.safeInternal() || mode == ToolPolicy.ApprovalMode.ALLOW) {
            return ToolExecution.completed(executeToolDirect(tool, call, ctx));
        }

        if (approvalGate == null) {
            return ToolExecution.completed(ToolResultData.failed(call.id(),
                    "Tool '" + tool.name() + "' requires approval but no approval gate is configured"));
        }
        ApprovalOutcome outcome;
        try {
            outcome = approvalGate.requestApproval(call);
        } catch (RuntimeException e) {
            log.error("Approval request failed for call {}", call.id(), e);
            return ToolExecution.completed(ToolResultData.failed(call.id(), "Approval request failed: " + e.getMessage()));
        }
        if (outcome.isPending()) {
            log.info("Tool call {} ({}) awaiting approval", call.id(), tool.name());
            return ToolExecution.pending(call.id());
        }
        if (!outcome.isAllowed()) {
            return ToolExecution.completed(ToolResultData.denied(call.id(), "Tool execution denied by user"));
        }
        return ToolExecution.completed(executeToolDirect(tool, call, ctx));
    }

    /** Runs the tool without any policy or approval check. */
    public ToolResultData executeToolDirect(Tool tool, ToolCallData call, ToolContext ctx) {
        if (ctx.cancellation().isCancelled()) {
            return ToolResultData.aborted(call.id());
        }
        try {
            ToolResult result = tool.execute(ctx, call.arguments());
            if (ctx.cancellation().isCancelled()) {
                return ToolResultData.aborted(call.id());
            }
            if (result == null) {
                return ToolResultData.failed(call.id(), "Tool '" + tool.name() + "' returned no result");
            }
            if (!result.success()) {
                return ToolResultData.failed(call.id(), result.error());
            }
            return new ToolResultData(call.id(), List.of(ContentBlock.text(result.outputText())), ToolResultStatus.COMPLETED);
        } catch (TurnCancelledException e) {
            return ToolResultData.aborted(call.id());
        } catch (Exception e) {
            log.warn("Tool '{}' failed for call {}: {}", tool.name(), call.id(), e.getMessage());
            return ToolResultData.failed(call.id(), "Tool '" + tool.name() + "' failed: " + e.getMessage());
        }
    }

    public ToolRegistry registry() {
        return registry;
    }
}
