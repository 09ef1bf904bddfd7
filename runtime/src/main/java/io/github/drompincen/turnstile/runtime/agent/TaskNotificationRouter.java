package io.github.drompincen.turnstile.runtime.agent;

import io.github.drompincen.turnstile.runtime.queue.QueuedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Delivers task updates between agents. Notifications jump the queue of the target agent.
 */
public class TaskNotificationRouter {

    private static final Logger log = LoggerFactory.getLogger(TaskNotificationRouter.class);
    static final String SOURCE = "task_system";

    private final AgentRegistry registry;

    public TaskNotificationRouter(AgentRegistry registry) {
        this.registry = registry;
    }

    /** Returns the queued message id, or empty when no agent owns the target thread. */
    public Optional<String> route(TaskNotification notification) {
        Optional<Agent> target = registry.get(notification.targetThreadId());
        if (target.isEmpty()) {
            log.warn("No agent for thread {}, dropping notification for task {}",
                    notification.targetThreadId(), notification.taskId());
            return Optional.empty();
        }
        QueuedMessage.Metadata metadata = new QueuedMessage.Metadata(
                notification.taskId(), notification.fromAgent(), QueuedMessage.Priority.HIGH, SOURCE);
        String id = target.get().queueMessage(notification.message(), QueuedMessage.Kind.TASK_NOTIFICATION, metadata);
        log.debug("Routed task {} notification to thread {}", notification.taskId(), notification.targetThreadId());
        return Optional.of(id);
    }
}
