package net.quay.core.service;

import net.quay.core.model.TaskError;
import net.quay.core.model.TaskMessage;

import java.time.Duration;

/**
 * 실패한 실행에 대한 판단표:
 * <pre>
 *   attempt &lt; maxRetries, transient  -> backoff(attempt) 뒤 재큐잉
 *   attempt &lt; maxRetries, permanent  -> dead-letter
 *   attempt >= maxRetries            -> dead-letter
 * </pre>
 */
public final class RetryPolicyEngine {

    public record Decision(Action action, Duration delay, TaskError error) {
        public enum Action { RETRY, DEAD_LETTER }

        public boolean retry() { return action == Action.RETRY; }
    }

    public Decision decide(TaskMessage message, TaskDefinition definition, Throwable failure) {
        TaskError.Kind kind = ErrorClassifier.classify(failure, definition);
        TaskError error = new TaskError(kind, ErrorClassifier.sanitize(failure));
        if (message.retriesLeft() && ErrorClassifier.retryable(kind, definition)) {
            Duration delay = definition.retryPolicy().nextBackoff(message.attempt());
            return new Decision(Decision.Action.RETRY, delay, error);
        }
        return new Decision(Decision.Action.DEAD_LETTER, Duration.ZERO, error);
    }
}
