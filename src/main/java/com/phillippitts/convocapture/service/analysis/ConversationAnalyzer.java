package com.phillippitts.convocapture.service.analysis;

/**
 * Downstream analysis of a finished conversation (facts, topics, summary).
 *
 * <p>Invoked once per stopped session, after the final transcript has been persisted.
 * Implementations may throw; the session logs the failure and does not retry.
 */
@FunctionalInterface
public interface ConversationAnalyzer {

    void analyze(long conversationId);
}
