package com.deepansh.foundry.resilience;

import com.deepansh.foundry.runtime.AgentSpec;
import com.deepansh.foundry.runtime.ConversationRuntime;
import com.deepansh.foundry.runtime.RunState;
import com.deepansh.foundry.runtime.ThreadMessage;
import com.deepansh.foundry.runtime.ToolOutput;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around FoundryAgentsClient that adds retry + circuit breaker
 * to the idempotent reads.
 *
 * getRun and listMessages are safe to repeat. Everything that creates,
 * submits or cancels is passed straight through: a retried submit could
 * deliver a batch of tool outputs twice.
 *
 * Retry / circuit breaker instance "foundryRuntime" (application.yml):
 * - 3 attempts, exponential backoff from 500ms
 * - Retries FoundryServerException and network errors; AgentException is final
 * - Opens after 50% failures in a window of 10 calls, 30s wait
 *
 * No fallbacks: there is no substitute for a run snapshot, so the last
 * failure (or CallNotPermittedException while open) reaches the caller.
 */
@Component
@Primary
@Slf4j
public class ResilientConversationRuntime implements ConversationRuntime {

    static final String INSTANCE = "foundryRuntime";

    private final ConversationRuntime delegate;

    public ResilientConversationRuntime(@Qualifier("foundryAgentsClient") ConversationRuntime delegate) {
        this.delegate = delegate;
    }

    @Override
    public String createAgent(AgentSpec spec) {
        return delegate.createAgent(spec);
    }

    @Override
    public void deleteAgent(String agentId) {
        delegate.deleteAgent(agentId);
    }

    @Override
    public String createThread() {
        return delegate.createThread();
    }

    @Override
    public void deleteThread(String threadId) {
        delegate.deleteThread(threadId);
    }

    @Override
    public void createMessage(String threadId, String content) {
        delegate.createMessage(threadId, content);
    }

    @Override
    public RunState createRun(String threadId, String agentId) {
        return delegate.createRun(threadId, agentId);
    }

    @Override
    @Retry(name = INSTANCE)
    @CircuitBreaker(name = INSTANCE)
    public RunState getRun(String threadId, String runId) {
        return delegate.getRun(threadId, runId);
    }

    @Override
    public RunState submitToolOutputs(String threadId, String runId, List<ToolOutput> outputs) {
        return delegate.submitToolOutputs(threadId, runId, outputs);
    }

    @Override
    public RunState cancelRun(String threadId, String runId) {
        return delegate.cancelRun(threadId, runId);
    }

    @Override
    @Retry(name = INSTANCE)
    @CircuitBreaker(name = INSTANCE)
    public List<ThreadMessage> listMessages(String threadId) {
        return delegate.listMessages(threadId);
    }
}
