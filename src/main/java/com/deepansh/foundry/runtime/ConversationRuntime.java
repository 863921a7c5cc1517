package com.deepansh.foundry.runtime;

import java.util.List;

/**
 * The external agents service that owns agents, threads and runs.
 *
 * Implementations translate transport failures into unchecked exceptions;
 * a run reported as failed is NOT an exception, it is a {@link RunState}
 * with status {@link RunStatus#FAILED}.
 */
public interface ConversationRuntime {

    /** @return id of the created agent */
    String createAgent(AgentSpec spec);

    void deleteAgent(String agentId);

    /** @return id of the created thread */
    String createThread();

    void deleteThread(String threadId);

    void createMessage(String threadId, String content);

    RunState createRun(String threadId, String agentId);

    RunState getRun(String threadId, String runId);

    /** Submits one output per pending call of the current batch, all at once. */
    RunState submitToolOutputs(String threadId, String runId, List<ToolOutput> outputs);

    RunState cancelRun(String threadId, String runId);

    /** Messages of the thread, newest first. */
    List<ThreadMessage> listMessages(String threadId);
}
